package com.example.store.domain.model;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

public class ProductTest {

	@Test
	@Tag("anchor")
	@DisplayName("名前と価格をそのまま保持する")
	void keeps_name_and_price() {
		Product laptop = new Product("Laptop", new BigDecimal("1000"));

		assertThat(laptop.name()).isEqualTo("Laptop");
		assertThat(laptop.price()).isEqualByComparingTo("1000");
	}

	@Test
	void zero_price_is_allowed() {
		assertThat(new Product("Sample", BigDecimal.ZERO).price()).isZero();
	}

	@Test
	@DisplayName("負の価格は IAE")
	void throws_when_price_negative() {
		assertThatThrownBy(() -> new Product("Laptop", new BigDecimal("-0.01")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("price must be >= 0");
	}

	@Test
	void throws_when_price_null() {
		assertThatThrownBy(() -> new Product("Laptop", null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("price must not be null");
	}

	@ParameterizedTest
	@NullAndEmptySource
	@ValueSource(strings = { " ", "\t" })
	void throws_when_name_blank(String name) {
		assertThatThrownBy(() -> new Product(name, BigDecimal.ONE))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("name must not be blank");
	}

	@Test
	@Tag("regression")
	@DisplayName("同じ名前と価格なら等価（値オブジェクト）")
	void equal_by_value() {
		assertThat(new Product("Phone", new BigDecimal("500")))
				.isEqualTo(new Product("Phone", new BigDecimal("500")));
	}
}
