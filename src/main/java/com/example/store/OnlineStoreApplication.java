package com.example.store;

import java.io.PrintStream;
import java.math.BigDecimal;

import com.example.store.domain.model.Order;
import com.example.store.domain.model.Product;
import com.example.store.domain.policy.Discount;
import com.example.store.domain.policy.discount.PercentageDiscount;
import com.example.store.dto.OrderResult;
import com.example.store.infrastructure.payment.CreditCardProcessor;

public class OnlineStoreApplication {
	private OnlineStoreApplication() {
	}

	public static void main(String[] args) {
		run(System.out);
	}

	// 配線はここだけ（コンストラクタ注入）
	public static OrderResult run(PrintStream out) {
		Product laptop = new Product("Laptop", new BigDecimal("1000"));
		Product phone = new Product("Phone", new BigDecimal("500"));

		Order order = new Order();
		order.addProduct(laptop);
		order.addProduct(phone);

		Discount discount = new PercentageDiscount(10);
		order.setDiscountStrategy(discount);

		return order.processOrder(new CreditCardProcessor(out));
	}
}
