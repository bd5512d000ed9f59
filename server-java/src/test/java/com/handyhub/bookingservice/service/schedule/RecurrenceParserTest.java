package com.handyhub.bookingservice.service.schedule;

import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.model.FrequencyUnit;
import com.handyhub.bookingservice.model.RecurrenceDescriptor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecurrenceParserTest {

    @Test
    void acceptsWeekdayNamesAbbreviationsAndNumbers() {
        assertThat(RecurrenceParser.parseWeekday("Sunday")).isZero();
        assertThat(RecurrenceParser.parseWeekday("wed")).isEqualTo(3);
        assertThat(RecurrenceParser.parseWeekday(" SATURDAY ")).isEqualTo(6);
        assertThat(RecurrenceParser.parseWeekday("4")).isEqualTo(4);
        assertThat(RecurrenceParser.parseWeekday(null)).isNull();
        assertThat(RecurrenceParser.parseWeekday("")).isNull();
    }

    @Test
    void rejectsUnknownWeekday() {
        assertThrows(InvalidInputException.class, () -> RecurrenceParser.parseWeekday("someday"));
        assertThrows(InvalidInputException.class, () -> RecurrenceParser.parseWeekday("7"));
    }

    @Test
    void parsesFullDescriptor() {
        RecurrenceDescriptor descriptor = RecurrenceParser.parse("Tuesday", "weeks", 2, null);

        assertThat(descriptor.getPreferredWeekday()).isEqualTo(2);
        assertThat(descriptor.getFrequencyUnit()).isEqualTo(FrequencyUnit.WEEK);
        assertThat(descriptor.getFrequencyInterval()).isEqualTo(2);
        assertThat(descriptor.effectiveCount()).isEqualTo(RecurrenceDescriptor.DEFAULT_HORIZON);
    }

    @Test
    void rejectsMalformedFrequency() {
        assertThrows(InvalidInputException.class, () -> RecurrenceParser.parse(null, "fortnight", 1, 4));
        assertThrows(InvalidInputException.class, () -> RecurrenceParser.parse(null, "month", 0, 4));
        assertThrows(InvalidInputException.class, () -> RecurrenceParser.parse(null, "month", null, 4));
    }

    @Test
    void horizonIsClampedIntoSupportedRange() {
        assertThat(RecurrenceParser.parse(null, "week", 1, 0).getHorizonCount()).isEqualTo(RecurrenceDescriptor.MIN_HORIZON);
        assertThat(RecurrenceParser.parse(null, "week", 1, -3).getHorizonCount()).isEqualTo(RecurrenceDescriptor.MIN_HORIZON);
        assertThat(RecurrenceParser.parse(null, "week", 1, 40).getHorizonCount()).isEqualTo(RecurrenceDescriptor.MAX_HORIZON);
        assertThat(RecurrenceParser.parse(null, "week", 1, 5).getHorizonCount()).isEqualTo(5);
    }
}
