package com.threatsentinel.core.window;

import java.io.Serializable;
import java.util.Objects;

/**
 * Partition of a counter by one event field, e.g. {@code userId=U1}.
 *
 * @since 1.0.0
 */
public final class GroupKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String value;

    public GroupKey(String field, String value) {
        this.field = Objects.requireNonNull(field, "Group field must not be null");
        this.value = Objects.requireNonNull(value, "Group value must not be null");
    }

    public static GroupKey of(String field, String value) {
        return new GroupKey(field, value);
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GroupKey that))
            return false;
        return field.equals(that.field) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, value);
    }

    @Override
    public String toString() {
        return field + '=' + value;
    }
}
