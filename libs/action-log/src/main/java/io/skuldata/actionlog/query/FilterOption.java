package io.skuldata.actionlog.query;

/** 画面のフィルタ選択肢 (値と表示名)。 */
public record FilterOption(String value, String label) {}
