package com.example.store.domain.policy;

import java.math.BigDecimal;

import com.example.store.dto.DiscountType;

public interface Discount {
	/**
	 * total: 割引前の合計金額
	 * 返り値: 割引「後」の合計金額（割引額ではない）
	 */
	BigDecimal apply(BigDecimal total);

	DiscountType type();
}
