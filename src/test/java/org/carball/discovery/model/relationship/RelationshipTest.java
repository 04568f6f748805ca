package org.carball.discovery.model.relationship;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RelationshipTest {

    private static final Evidence EVIDENCE = new Evidence("match_ratio", 0.9, 0.9, "sampled");

    @Test
    public void shouldRejectConfidenceOutsideUnitInterval() {
        assertThatThrownBy(() -> relationship(1.2, List.of(EVIDENCE)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("within [0, 1]");
        assertThatThrownBy(() -> relationship(-0.1, List.of(EVIDENCE)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> relationship(Double.NaN, List.of(EVIDENCE)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldRequireEvidence() {
        assertThatThrownBy(() -> relationship(0.5, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no evidence");
    }

    @Test
    public void shouldDeriveIdAndConnectBothDirections() {
        // When
        Relationship relationship = relationship(0.8, List.of(EVIDENCE));

        // Then
        assertThat(relationship.id()).isEqualTo("join:Transaction.orderId->Order.id");
        assertThat(relationship.connects("Order", "Transaction")).isTrue();
        assertThat(relationship.connects("Order", "PageView")).isFalse();
        assertThat(relationship.metadata()).isEmpty();
    }

    @Test
    public void shouldClassifyCorrelationStrength() {
        assertThat(CorrelationStrength.of(0.85)).isEqualTo(CorrelationStrength.STRONG_POSITIVE);
        assertThat(CorrelationStrength.of(0.5)).isEqualTo(CorrelationStrength.MODERATE_POSITIVE);
        assertThat(CorrelationStrength.of(0.1)).isEqualTo(CorrelationStrength.WEAK);
        assertThat(CorrelationStrength.of(-0.5)).isEqualTo(CorrelationStrength.MODERATE_NEGATIVE);
        assertThat(CorrelationStrength.of(-0.9)).isEqualTo(CorrelationStrength.STRONG_NEGATIVE);
    }

    @Test
    public void shouldDeriveJoinCardinalityFromUniqueness() {
        assertThat(JoinCardinality.of(true, true)).isEqualTo(JoinCardinality.ONE_TO_ONE);
        assertThat(JoinCardinality.of(true, false)).isEqualTo(JoinCardinality.ONE_TO_MANY);
        assertThat(JoinCardinality.of(false, true)).isEqualTo(JoinCardinality.MANY_TO_ONE);
        assertThat(JoinCardinality.of(false, false).getConfidenceFactor()).isEqualTo(0.85);
    }

    private static Relationship relationship(double confidence, List<Evidence> evidence) {
        return Relationship.builder()
                .type(RelationshipType.JOIN)
                .sourceSchema("Transaction")
                .sourceAttribute("orderId")
                .targetSchema("Order")
                .targetAttribute("id")
                .confidence(confidence)
                .evidence(evidence)
                .build();
    }
}
