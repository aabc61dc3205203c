package com.polyhunter.bounty.entity;

import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class RequestStatusConverter extends PersistedValueConverter<RequestStatus> {

    public RequestStatusConverter() {
        super(RequestStatus.class);
    }
}
