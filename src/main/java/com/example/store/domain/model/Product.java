package com.example.store.domain.model;

import java.math.BigDecimal;

import com.example.store.domain.validation.AmountValidator;

public record Product(String name, BigDecimal price) {
	public Product {
		if (name == null || name.isBlank())
			throw new IllegalArgumentException("name must not be blank");
		AmountValidator.requireNonNegative(price, "price");
	}
}
