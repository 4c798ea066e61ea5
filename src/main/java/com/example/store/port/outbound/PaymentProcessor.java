package com.example.store.port.outbound;

import java.math.BigDecimal;

public interface PaymentProcessor {
	// 割引適用後の最終金額を受け取る。戻り値なし（副作用のみ）
	void processPayment(BigDecimal amount);
}
