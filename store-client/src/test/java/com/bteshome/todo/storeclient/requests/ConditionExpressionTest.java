package com.bteshome.todo.storeclient.requests;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionExpressionTest {
    @Test
    void rendersDynamoDbSyntax() {
        assertThat(ConditionExpression.attributeNotExists("id").toExpression()).isEqualTo("attribute_not_exists(id)");
        assertThat(ConditionExpression.attributeExists("id").toExpression()).isEqualTo("attribute_exists(id)");
    }

    @Test
    void attributeExistsRequiresAnItemWithTheAttribute() {
        ConditionExpression condition = ConditionExpression.attributeExists("id");

        assertThat(condition.isSatisfiedBy(null)).isFalse();
        assertThat(condition.isSatisfiedBy(Map.of("title", "A"))).isFalse();
        assertThat(condition.isSatisfiedBy(Map.of("id", "1"))).isTrue();
    }

    @Test
    void attributeNotExistsHoldsOnlyWithoutTheAttribute() {
        ConditionExpression condition = ConditionExpression.attributeNotExists("id");

        assertThat(condition.isSatisfiedBy(null)).isTrue();
        assertThat(condition.isSatisfiedBy(Map.of("title", "A"))).isTrue();
        assertThat(condition.isSatisfiedBy(Map.of("id", "1"))).isFalse();
    }
}
