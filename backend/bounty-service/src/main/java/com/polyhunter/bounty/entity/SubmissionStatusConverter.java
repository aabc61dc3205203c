package com.polyhunter.bounty.entity;

import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SubmissionStatusConverter extends PersistedValueConverter<SubmissionStatus> {

    public SubmissionStatusConverter() {
        super(SubmissionStatus.class);
    }
}
