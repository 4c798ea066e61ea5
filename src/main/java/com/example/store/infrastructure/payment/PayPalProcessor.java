package com.example.store.infrastructure.payment;

import java.io.PrintStream;
import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.store.domain.validation.AmountValidator;
import com.example.store.port.outbound.PaymentProcessor;

public class PayPalProcessor implements PaymentProcessor {
	private static final Logger log = LoggerFactory.getLogger(PayPalProcessor.class);

	private final PrintStream out;

	public PayPalProcessor() {
		this(System.out);
	}

	public PayPalProcessor(PrintStream out) {
		if (out == null)
			throw new IllegalArgumentException("out must not be null");
		this.out = out;
	}

	@Override
	public void processPayment(BigDecimal amount) {
		AmountValidator.requireNonNegative(amount, "amount");
		log.debug("paypal charge: amount={}", amount);
		out.println("Processing PayPal payment of $" + AmountFormatter.format(amount));
	}
}
