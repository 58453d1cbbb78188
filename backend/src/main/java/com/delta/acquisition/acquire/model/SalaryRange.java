package com.delta.acquisition.acquire.model;

public record SalaryRange(
    Double min,
    Double max,
    String currency
) {
    public String display() {
        StringBuilder out = new StringBuilder();
        if (min != null) {
            out.append(formatAmount(min));
        }
        if (max != null && !max.equals(min)) {
            if (out.length() > 0) {
                out.append(" - ");
            }
            out.append(formatAmount(max));
        }
        if (currency != null && !currency.isBlank() && out.length() > 0) {
            out.append(' ').append(currency.trim());
        }
        return out.length() == 0 ? null : out.toString();
    }

    private static String formatAmount(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
