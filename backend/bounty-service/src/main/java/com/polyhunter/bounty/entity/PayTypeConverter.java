package com.polyhunter.bounty.entity;

import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class PayTypeConverter extends PersistedValueConverter<PayType> {

    public PayTypeConverter() {
        super(PayType.class);
    }
}
