package io.kestra.plugin.groupby.message;

import io.kestra.plugin.groupby.model.DateGranularity;

import java.util.List;
import java.util.Map;

/**
 * Builds the errors and advisories this step reports.
 */
public final class Messages {
    private Messages() {
    }

    public static RenderError nonNumericColumns(List<String> colnames) {
        return new RenderError(
            new I18nMessage("non_numeric_colnames.error", Map.of(
                "n_columns", colnames.size(),
                "first_colname", colnames.get(0)
            )),
            List.of(new QuickFix(
                I18nMessage.of("non_numeric_colnames.quick_fix.text"),
                new PrependStep("converttexttonumber", Map.of("colnames", List.copyOf(colnames)))
            ))
        );
    }

    public static RenderError selectDateColumns() {
        return RenderError.of(I18nMessage.of("group_dates.select_date_columns"));
    }

    public static RenderError timestampSelected(List<String> colnames) {
        return new RenderError(
            new I18nMessage("group_dates.timestamp_selected", columnsArguments(colnames)),
            List.of(new QuickFix(
                I18nMessage.of("group_dates.quick_fix.convert_timestamp_to_date"),
                new PrependStep("converttimestamptodate", Map.of("colnames", List.copyOf(colnames)))
            ))
        );
    }

    public static RenderError textSelected(List<String> colnames) {
        return new RenderError(
            new I18nMessage("group_dates.text_selected", columnsArguments(colnames)),
            List.of(
                new QuickFix(
                    I18nMessage.of("group_dates.quick_fix.convert_text_to_date"),
                    new PrependStep("converttexttodate", Map.of("colnames", List.copyOf(colnames)))
                ),
                new QuickFix(
                    I18nMessage.of("group_dates.quick_fix.convert_text_to_timestamp"),
                    new PrependStep("convert-date", Map.of("colnames", List.copyOf(colnames)))
                )
            )
        );
    }

    public static RenderError granularityDeprecated(DateGranularity granularity, List<String> colnames) {
        if (granularity.isSubDaily()) {
            return new RenderError(
                I18nMessage.of("group_dates.granularity_deprecated.need_rounding"),
                List.of(new QuickFix(
                    I18nMessage.of("group_dates.granularity_deprecated.quick_fix.round_timestamps"),
                    new PrependStep("timestampmath", Map.of(
                        "colnames", List.copyOf(colnames),
                        "operation", "startof",
                        "roundunit", granularity.unit()
                    ))
                ))
            );
        }
        return new RenderError(
            I18nMessage.of("group_dates.granularity_deprecated.need_dates"),
            List.of(new QuickFix(
                I18nMessage.of("group_dates.granularity_deprecated.quick_fix.convert_to_date"),
                new PrependStep("converttimestamptodate", Map.of(
                    "colnames", List.copyOf(colnames),
                    "unit", granularity.unit()
                ))
            ))
        );
    }

    private static Map<String, Object> columnsArguments(List<String> colnames) {
        return Map.of("columns", colnames.size(), "column0", colnames.get(0));
    }
}
