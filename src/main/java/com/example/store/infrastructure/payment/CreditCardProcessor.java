package com.example.store.infrastructure.payment;

import java.io.PrintStream;
import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.store.domain.validation.AmountValidator;
import com.example.store.port.outbound.PaymentProcessor;

public class CreditCardProcessor implements PaymentProcessor {
	private static final Logger log = LoggerFactory.getLogger(CreditCardProcessor.class);

	private final PrintStream out;

	public CreditCardProcessor() {
		this(System.out);
	}

	public CreditCardProcessor(PrintStream out) {
		if (out == null)
			throw new IllegalArgumentException("out must not be null");
		this.out = out;
	}

	@Override
	public void processPayment(BigDecimal amount) {
		AmountValidator.requireNonNegative(amount, "amount");
		log.debug("credit card charge: amount={}", amount);
		out.println("Processing credit card payment of $" + AmountFormatter.format(amount));
	}
}
