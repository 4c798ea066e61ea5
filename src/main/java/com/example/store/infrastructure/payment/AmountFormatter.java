package com.example.store.infrastructure.payment;

import java.math.BigDecimal;

public class AmountFormatter {
	private AmountFormatter() {
	}

	// 1350.00 -> "1350", 12.50 -> "12.5", 0.00 -> "0"（指数表記にはしない）
	public static String format(BigDecimal amount) {
		return amount.stripTrailingZeros().toPlainString();
	}
}
