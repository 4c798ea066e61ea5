package com.example.store.domain.policy.discount;

import java.math.BigDecimal;

import com.example.store.domain.policy.Discount;
import com.example.store.domain.validation.AmountValidator;
import com.example.store.dto.DiscountType;

public class NoDiscount implements Discount {

	@Override
	public BigDecimal apply(BigDecimal total) {
		return AmountValidator.requirePresent(total, "total");
	}

	@Override
	public DiscountType type() {
		return DiscountType.NONE;
	}
}
