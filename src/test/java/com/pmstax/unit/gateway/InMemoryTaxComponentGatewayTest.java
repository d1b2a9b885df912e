package com.pmstax.unit.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.domain.model.TaxYear;
import com.pmstax.exception.ComponentValidationException;
import com.pmstax.gateway.InMemoryTaxComponentGateway;
import com.pmstax.revision.ComponentUpdateRequest;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryTaxComponentGatewayTest {

    private static final ComponentKey KEY = ComponentKey.of("EMP001", TaxYear.of(2024), ComponentKind.DEDUCTIONS);

    private final InMemoryTaxComponentGateway gateway = new InMemoryTaxComponentGateway();

    private static ComponentUpdateRequest update(Map<String, Object> payload) {
        return ComponentUpdateRequest.builder()
                .employeeId("EMP001")
                .taxYear("2024-25")
                .kind(ComponentKind.DEDUCTIONS)
                .payload(payload)
                .notes("Updated via individual component management")
                .build();
    }

    @Test
    void getComponent_unknownKeyIsEmpty() {
        assertThat(gateway.getComponent(KEY)).isEmpty();
    }

    @Test
    void firstUpdate_startsAtTaxYearStart() {
        Map<String, Object> response =
                gateway.updateComponent(ComponentKind.DEDUCTIONS, update(Map.of("section_80c", Map.of("tuition_fees", 40000))));

        assertThat(response).containsEntry("revision_number", 1)
                .containsEntry("effective_from", "2024-04-01")
                .containsEntry("component_type", "deductions");
        assertThat(gateway.getComponent(KEY)).hasValueSatisfying(
                data -> assertThat(data).containsEntry("section_80c", Map.of("tuition_fees", 40000)));
    }

    @Test
    void laterUpdate_mergesIntoActiveRevision() {
        gateway.updateComponent(ComponentKind.DEDUCTIONS, update(Map.of("section_80c", Map.of("tuition_fees", 40000))));
        gateway.updateComponent(ComponentKind.DEDUCTIONS, update(Map.of("section_80c", Map.of("ulip_premium", 10000))));

        assertThat(gateway.getHistory(KEY)).hasSize(1);
        assertThat(gateway.getComponent(KEY)).hasValueSatisfying(data -> assertThat(data)
                .containsEntry("section_80c", Map.of("tuition_fees", 40000, "ulip_premium", 10000)));
    }

    @Test
    void forcedNewRevision_closesPrevious() {
        gateway.updateComponent(ComponentKind.DEDUCTIONS, update(Map.of("section_80c", Map.of("tuition_fees", 40000))));

        Map<String, Object> response = gateway.updateComponent(
                ComponentKind.DEDUCTIONS,
                ComponentUpdateRequest.builder()
                        .employeeId("EMP001")
                        .taxYear("2024-25")
                        .kind(ComponentKind.DEDUCTIONS)
                        .payload(Map.of("section_80c", Map.of("tuition_fees", 60000)))
                        .forceNewRevision(true)
                        .effectiveFrom(LocalDate.of(2024, 10, 1))
                        .build());

        assertThat(response).containsEntry("revision_number", 2);
        assertThat(gateway.getHistory(KEY)).hasSize(2);
        assertThat(gateway.getHistory(KEY).get(0).getEffectiveTill()).isEqualTo(LocalDate.of(2024, 10, 1));
        assertThat(gateway.getComponent(KEY)).hasValueSatisfying(
                data -> assertThat(data).containsEntry("section_80c", Map.of("tuition_fees", 60000)));
    }

    @Test
    void forcedNewRevision_beforeActiveStart_isRejected() {
        gateway.updateComponent(ComponentKind.DEDUCTIONS, update(Map.of("section_80c", Map.of("tuition_fees", 40000))));

        ComponentUpdateRequest request = ComponentUpdateRequest.builder()
                .employeeId("EMP001")
                .taxYear("2024-25")
                .kind(ComponentKind.DEDUCTIONS)
                .payload(Map.of())
                .forceNewRevision(true)
                .effectiveFrom(LocalDate.of(2024, 4, 1))
                .build();

        assertThatThrownBy(() -> gateway.updateComponent(ComponentKind.DEDUCTIONS, request))
                .isInstanceOf(ComponentValidationException.class)
                .hasMessageStartingWith("Effective from date must be after 2024-04-01");
    }

    @Test
    void returnedRecordIsACopy() {
        gateway.updateComponent(ComponentKind.DEDUCTIONS, update(Map.of("section_80c", Map.of("tuition_fees", 40000))));

        gateway.getComponent(KEY).orElseThrow().put("section_80c", "changed");

        assertThat(gateway.getComponent(KEY).orElseThrow().get("section_80c")).isInstanceOf(Map.class);
    }
}
