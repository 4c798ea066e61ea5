package com.example.store.dto;

import java.math.BigDecimal;

public record OrderResult(
		BigDecimal totalBeforeDiscount,
		BigDecimal totalDiscount,
		BigDecimal totalAfterDiscount,
		DiscountType appliedDiscount // 未設定時は NONE
) {}
