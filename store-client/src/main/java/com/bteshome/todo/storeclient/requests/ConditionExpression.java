package com.bteshome.todo.storeclient.requests;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

/**
 * Existence condition evaluated by the store against the current version of an item.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConditionExpression {
    private ConditionType type;
    private String attributeName;

    public enum ConditionType {
        ATTRIBUTE_EXISTS,
        ATTRIBUTE_NOT_EXISTS
    }

    public static ConditionExpression attributeExists(String attributeName) {
        return new ConditionExpression(ConditionType.ATTRIBUTE_EXISTS, attributeName);
    }

    public static ConditionExpression attributeNotExists(String attributeName) {
        return new ConditionExpression(ConditionType.ATTRIBUTE_NOT_EXISTS, attributeName);
    }

    /**
     * Renders the condition in DynamoDB expression syntax, e.g. {@code attribute_not_exists(id)}.
     */
    public String toExpression() {
        return switch (type) {
            case ATTRIBUTE_EXISTS -> "attribute_exists(%s)".formatted(attributeName);
            case ATTRIBUTE_NOT_EXISTS -> "attribute_not_exists(%s)".formatted(attributeName);
        };
    }

    /**
     * @param existingItem the stored item, or null if there is none
     */
    public boolean isSatisfiedBy(Map<String, String> existingItem) {
        boolean attributePresent = existingItem != null && existingItem.containsKey(attributeName);
        return switch (type) {
            case ATTRIBUTE_EXISTS -> attributePresent;
            case ATTRIBUTE_NOT_EXISTS -> !attributePresent;
        };
    }

    @Override
    public String toString() {
        return toExpression();
    }
}
