package com.flagship.payroll_ledger.payment;

import java.util.Arrays;
import java.util.Optional;

/**
 * Payment methods offered when recording a payment.
 * Stored by label, so existing records keep their original text.
 */
public enum PaymentType {
    BANK_TRANSFER("Bank Transfer"),
    PAYPAL("PayPal"),
    CASH("Cash"),
    OTHER("Other");

    private final String label;

    PaymentType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<PaymentType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.label.equalsIgnoreCase(label.trim()))
            .findFirst();
    }
}
