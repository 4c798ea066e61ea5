package com.example.store.dto;

public enum DiscountType {
	NONE,
	PERCENTAGE
}
