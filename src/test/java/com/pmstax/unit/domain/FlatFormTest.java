package com.pmstax.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pmstax.domain.model.FlatForm;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class FlatFormTest {

    @Test
    void equals_comparesNumbersByValue() {
        FlatForm a = new FlatForm().put("bonus", new BigDecimal("100")).put("city", "metro");
        FlatForm b = new FlatForm().put("bonus", new BigDecimal("100.00")).put("city", "metro");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void put_rejectsUnsupportedValues() {
        FlatForm form = new FlatForm();

        assertThatThrownBy(() -> form.put("bonus", 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> form.put("items", List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> form.put("bonus", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void typedGetters_defaultWhenAbsent() {
        FlatForm form = new FlatForm().put("driver_provided", true);

        assertThat(form.getNumber("bonus")).isEqualByComparingTo("0");
        assertThat(form.getString("address")).isEmpty();
        assertThat(form.getBoolean("driver_provided")).isTrue();
    }

    @Test
    void numericValues_skipsTextAndFlags() {
        FlatForm form = new FlatForm()
                .put("bonus", new BigDecimal("5000"))
                .put("city", "metro")
                .put("driver_provided", false);

        assertThat(form.numericValues()).containsOnlyKeys("bonus");
    }

    @Test
    void copyOf_isIndependent() {
        FlatForm original = new FlatForm().put("bonus", BigDecimal.ONE);
        FlatForm copy = FlatForm.copyOf(original);

        copy.put("bonus", BigDecimal.TEN);

        assertThat(original.getNumber("bonus")).isEqualByComparingTo("1");
    }
}
