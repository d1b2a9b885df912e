package com.pmstax.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmstax.domain.enums.FieldType;
import org.junit.jupiter.api.Test;

class FieldTypeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void fromTag_knownTags() {
        assertThat(FieldType.fromTag("loan_amount")).isEqualTo(FieldType.LOAN_AMOUNT);
        assertThat(FieldType.fromTag(" HRA ")).isEqualTo(FieldType.HRA);
        assertThat(FieldType.fromTag("section_80c_component")).isEqualTo(FieldType.SECTION_80C_COMPONENT);
    }

    @Test
    void fromTag_unknownAmountTagIsAmount() {
        assertThat(FieldType.fromTag("gratuity_amount")).isEqualTo(FieldType.AMOUNT);
    }

    @Test
    void fromTag_otherTagsAreText() {
        assertThat(FieldType.fromTag("foo")).isEqualTo(FieldType.TEXT);
        assertThat(FieldType.fromTag(null)).isEqualTo(FieldType.TEXT);
    }

    @Test
    void isAmountLike_onlyAmountTags() {
        assertThat(FieldType.isAmountLike("amount")).isTrue();
        assertThat(FieldType.isAmountLike("loan_amount")).isTrue();
        assertThat(FieldType.isAmountLike("hra")).isFalse();
        assertThat(FieldType.isAmountLike(null)).isFalse();
    }

    @Test
    void isFreeText_textAndSelect() {
        assertThat(FieldType.TEXT.isFreeText()).isTrue();
        assertThat(FieldType.SELECT.isFreeText()).isTrue();
        assertThat(FieldType.AMOUNT.isFreeText()).isFalse();
    }

    @Test
    void json_usesTag() throws Exception {
        assertThat(objectMapper.writeValueAsString(FieldType.LOAN_AMOUNT)).isEqualTo("\"loan_amount\"");
        assertThat(objectMapper.readValue("\"gratuity_amount\"", FieldType.class)).isEqualTo(FieldType.AMOUNT);
        assertThat(objectMapper.readValue("\"percentage\"", FieldType.class)).isEqualTo(FieldType.PERCENTAGE);
    }
}
