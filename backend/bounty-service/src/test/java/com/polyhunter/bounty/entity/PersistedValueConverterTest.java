package com.polyhunter.bounty.entity;

import com.polyhunter.bounty.exception.UnknownValueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersistedValueConverterTest {

    private final RequestStatusConverter requestStatusConverter = new RequestStatusConverter();
    private final SubmissionStatusConverter submissionStatusConverter = new SubmissionStatusConverter();

    @Test
    void storesLowerCaseTokens() {
        assertThat(requestStatusConverter.convertToDatabaseColumn(RequestStatus.PENDING_REVIEW))
                .isEqualTo("pending_review");
        assertThat(requestStatusConverter.convertToEntityAttribute("pending_review"))
                .isEqualTo(RequestStatus.PENDING_REVIEW);
        assertThat(submissionStatusConverter.convertToEntityAttribute(null)).isNull();
    }

    @Test
    @DisplayName("A stored token nothing maps to is a data fault, not a client error")
    void unknownStoredValueIsIllegalState() {
        assertThatThrownBy(() -> requestStatusConverter.convertToEntityAttribute("bogus"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Unknown stored RequestStatus value: bogus");
    }

    @Test
    @DisplayName("Client-supplied values fail with a typed exception")
    void unknownClientValueIsTyped() {
        assertThat(RequestStatus.fromValue("PUBLISHED")).isEqualTo(RequestStatus.PUBLISHED);

        assertThatThrownBy(() -> RequestStatus.fromValue("bogus"))
                .isInstanceOf(UnknownValueException.class)
                .hasMessage("Unknown request status: bogus");
        assertThatThrownBy(() -> SubmissionStatus.fromValue("bogus"))
                .isInstanceOf(UnknownValueException.class)
                .hasMessage("Unknown submission status: bogus");
        assertThatThrownBy(() -> ReviewAction.fromValue("approve"))
                .isInstanceOf(UnknownValueException.class)
                .hasMessage("Invalid review action: approve");
    }
}
