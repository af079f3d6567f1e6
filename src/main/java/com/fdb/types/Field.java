package com.fdb.types;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * A value read from one column of one row.
 * <p>
 * The {@code asX} accessors return the value when the field holds that variant and {@code null} otherwise,
 * so callers decide themselves whether a missing or differently typed value is fatal.
 */
public abstract class Field {

    public abstract TypeCode getTypeCode();
    public abstract boolean equals(Object obj);
    public abstract int hashCode();
    public abstract String toString();

    public Integer asInteger() { return null; }

    public Float asFloat() { return null; }

    public Boolean asBoolean() { return null; }

    public Latin1Str asText() { return null; }

    public Long asBigInt() { return null; }

    public boolean isNothing() {
        return getTypeCode() == TypeCode.NOTHING;
    }

    // Factory methods
    public static Field nothing() {
        return NothingField.INSTANCE;
    }

    public static Field fromInteger(int value) {
        return new IntegerField(value);
    }

    public static Field fromFloat(float value) {
        return new FloatField(value);
    }

    public static Field fromBoolean(boolean value) {
        return value ? BooleanField.TRUE : BooleanField.FALSE;
    }

    public static Field fromText(Latin1Str value) {
        return new TextField(value);
    }

    public static Field fromBigInt(long value) {
        return new BigIntField(value);
    }

    // Nothing
    @EqualsAndHashCode(callSuper = false)
    public static class NothingField extends Field {
        public static final NothingField INSTANCE = new NothingField();

        private NothingField() {}

        @Override
        public TypeCode getTypeCode() { return TypeCode.NOTHING; }

        @Override
        public String toString() {
            return "null";
        }
    }

    // Integer
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class IntegerField extends Field {
        private final int value;

        public IntegerField(int value) {
            this.value = value;
        }

        @Override
        public TypeCode getTypeCode() { return TypeCode.INTEGER; }

        @Override
        public Integer asInteger() { return value; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // Float
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class FloatField extends Field {
        private final float value;

        public FloatField(float value) {
            this.value = value;
        }

        @Override
        public TypeCode getTypeCode() { return TypeCode.FLOAT; }

        @Override
        public Float asFloat() { return value; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // Boolean
    @EqualsAndHashCode(callSuper = false)
    public static class BooleanField extends Field {
        static final BooleanField TRUE = new BooleanField(true);
        static final BooleanField FALSE = new BooleanField(false);

        private final boolean value;

        private BooleanField(boolean value) {
            this.value = value;
        }

        public boolean getValue() { return value; }

        @Override
        public TypeCode getTypeCode() { return TypeCode.BOOLEAN; }

        @Override
        public Boolean asBoolean() { return value; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // Text (borrowed from the backing buffer)
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class TextField extends Field {
        private final Latin1Str value;

        public TextField(Latin1Str value) {
            this.value = Objects.requireNonNull(value, "Text cannot be null");
        }

        @Override
        public TypeCode getTypeCode() { return TypeCode.TEXT; }

        @Override
        public Latin1Str asText() { return value; }

        @Override
        public String toString() {
            return "\"" + value.decode() + "\"";
        }
    }

    // BigInt
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class BigIntField extends Field {
        private final long value;

        public BigIntField(long value) {
            this.value = value;
        }

        @Override
        public TypeCode getTypeCode() { return TypeCode.BIGINT; }

        @Override
        public Long asBigInt() { return value; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }
}
