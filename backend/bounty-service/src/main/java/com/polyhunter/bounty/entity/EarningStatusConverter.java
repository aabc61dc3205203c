package com.polyhunter.bounty.entity;

import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class EarningStatusConverter extends PersistedValueConverter<EarningStatus> {

    public EarningStatusConverter() {
        super(EarningStatus.class);
    }
}
