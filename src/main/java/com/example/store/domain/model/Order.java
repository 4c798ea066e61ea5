package com.example.store.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.store.domain.policy.Discount;
import com.example.store.dto.DiscountType;
import com.example.store.dto.OrderResult;
import com.example.store.port.outbound.PaymentProcessor;

/**
 * 商品の集約と割引・支払いの委譲を行う。
 * 合計はキャッシュせず、呼び出しごとに現在の商品リストから再計算する。
 * スレッドセーフではない（1呼び出し元が所有する前提）。
 */
public class Order {
	private static final Logger log = LoggerFactory.getLogger(Order.class);

	private final List<Product> products = new ArrayList<>();
	private Discount discountStrategy; // null = 割引なし

	// 重複も上限もなし、追加順を保持
	public void addProduct(Product product) {
		if (product == null)
			throw new IllegalArgumentException("product must not be null");
		products.add(product);
	}

	// 直前の戦略を置き換える。null で解除
	public void setDiscountStrategy(Discount discountStrategy) {
		this.discountStrategy = discountStrategy;
	}

	// 呼び出し時点のスナップショット（以後の addProduct は反映されない）
	public List<Product> getProducts() {
		return List.copyOf(products);
	}

	public Optional<Discount> getDiscountStrategy() {
		return Optional.ofNullable(discountStrategy);
	}

	// 小計計算
	public BigDecimal calculateTotal() {
		return products.stream()
				.map(Product::price)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
	}

	public OrderResult processOrder(PaymentProcessor paymentProcessor) {
		if (paymentProcessor == null)
			throw new IllegalArgumentException("paymentProcessor must not be null");

		BigDecimal totalBeforeDiscount = calculateTotal();
		BigDecimal totalAfterDiscount = totalBeforeDiscount;
		DiscountType applied = DiscountType.NONE;
		if (discountStrategy != null) {
			totalAfterDiscount = discountStrategy.apply(totalBeforeDiscount);
			applied = discountStrategy.type();
		}
		log.debug("processOrder: items={}, before={}, after={}, discount={}",
				products.size(), totalBeforeDiscount, totalAfterDiscount, applied);

		// 支払いは最後（計算で失敗した場合は副作用を起こさない）
		paymentProcessor.processPayment(totalAfterDiscount);

		return new OrderResult(
				totalBeforeDiscount,
				totalBeforeDiscount.subtract(totalAfterDiscount),
				totalAfterDiscount,
				applied);
	}
}
