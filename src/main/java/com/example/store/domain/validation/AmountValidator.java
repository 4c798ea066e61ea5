package com.example.store.domain.validation;

import java.math.BigDecimal;

public class AmountValidator {
	private AmountValidator() {
	}

	public static BigDecimal requirePresent(BigDecimal amount, String name) {
		if (amount == null)
			throw new IllegalArgumentException(name + " must not be null");
		return amount;
	}

	public static BigDecimal requireNonNegative(BigDecimal amount, String name) {
		requirePresent(amount, name);
		if (amount.signum() < 0)
			throw new IllegalArgumentException(name + " must be >= 0");
		return amount;
	}

	// 範囲外はクランプせず例外
	public static BigDecimal requireBetween(BigDecimal value, BigDecimal min, BigDecimal max, String name) {
		if (value == null)
			throw new IllegalArgumentException(name + " must not be null");
		if (value.compareTo(min) < 0 || value.compareTo(max) > 0)
			throw new IllegalArgumentException(
					name + " must be between " + min.toPlainString() + " and " + max.toPlainString());
		return value;
	}
}
