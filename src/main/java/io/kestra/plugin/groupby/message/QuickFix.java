package io.kestra.plugin.groupby.message;

public record QuickFix(I18nMessage text, PrependStep action) {
}
