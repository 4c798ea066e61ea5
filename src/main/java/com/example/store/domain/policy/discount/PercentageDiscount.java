package com.example.store.domain.policy.discount;

import java.math.BigDecimal;

import com.example.store.domain.policy.Discount;
import com.example.store.domain.validation.AmountValidator;
import com.example.store.dto.DiscountType;

public class PercentageDiscount implements Discount {
	private static final BigDecimal MAX_PERCENT = new BigDecimal("100");

	private final BigDecimal percent; // 例: 10 = 10%

	public PercentageDiscount(BigDecimal percent) {
		this.percent = AmountValidator.requireBetween(percent, BigDecimal.ZERO, MAX_PERCENT, "percent");
	}

	public PercentageDiscount(long percent) {
		this(BigDecimal.valueOf(percent));
	}

	public BigDecimal percent() {
		return percent;
	}

	@Override
	public BigDecimal apply(BigDecimal total) {
		AmountValidator.requirePresent(total, "total");
		// total - total * percent / 100 （movePointLeftで丸めなし）
		return total.subtract(total.multiply(percent).movePointLeft(2));
	}

	@Override
	public DiscountType type() {
		return DiscountType.PERCENTAGE;
	}
}
