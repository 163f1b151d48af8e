/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

/**
 * The base class of every value held in a document. The type system is
 * JSON's, extended with timestamps, binary data, document references and
 * geographic points; see {@link Type}.
 * <p>
 * The typed accessors and the asX casts throw ClassCastException when the
 * value has another type. No coercion is done, an INTEGER is never read as
 * a DOUBLE or the other way around.
 * <p>
 * Atomic values are immutable and may be shared. {@link MapValue} and
 * {@link ArrayValue} are mutable containers; {@link #copy} gives an
 * independent instance. FieldValue instances are not thread-safe.
 */
public abstract class FieldValue {

    /**
     * The type of a value.
     */
    public enum Type {
        /** null */
        NULL,
        /** true or false */
        BOOLEAN,
        /** a signed 64-bit integer */
        INTEGER,
        /** a double precision number */
        DOUBLE,
        /** an instant in UTC with nanosecond precision */
        TIMESTAMP,
        /** a string */
        STRING,
        /** a byte array */
        BINARY,
        /** the path of another document */
        REFERENCE,
        /** a latitude/longitude pair */
        GEO_POINT,
        /** an ordered list of values */
        ARRAY,
        /** string keys to values */
        MAP
    }

    /**
     * @return the type of this value
     */
    public abstract Type getType();

    /**
     * @return the value of an IntegerValue
     * @throws ClassCastException if this is not an IntegerValue
     */
    public long getLong() {
        return asInteger().getValue();
    }

    /**
     * @return the value of a DoubleValue
     * @throws ClassCastException if this is not a DoubleValue
     */
    public double getDouble() {
        return asDouble().getValue();
    }

    /**
     * @return a copy of the bytes of a BinaryValue
     * @throws ClassCastException if this is not a BinaryValue
     */
    public byte[] getBinary() {
        return asBinary().getValue();
    }

    /**
     * @return the value of a BooleanValue
     * @throws ClassCastException if this is not a BooleanValue
     */
    public boolean getBoolean() {
        return asBoolean().getValue();
    }

    /**
     * @return the value of a StringValue
     * @throws ClassCastException if this is not a StringValue
     */
    public String getString() {
        return asString().getValue();
    }

    public IntegerValue asInteger() {
        return cast(IntegerValue.class);
    }

    public DoubleValue asDouble() {
        return cast(DoubleValue.class);
    }

    public StringValue asString() {
        return cast(StringValue.class);
    }

    public BooleanValue asBoolean() {
        return cast(BooleanValue.class);
    }

    public BinaryValue asBinary() {
        return cast(BinaryValue.class);
    }

    public TimestampValue asTimestamp() {
        return cast(TimestampValue.class);
    }

    public ReferenceValue asReference() {
        return cast(ReferenceValue.class);
    }

    public GeoPointValue asGeoPoint() {
        return cast(GeoPointValue.class);
    }

    public ArrayValue asArray() {
        return cast(ArrayValue.class);
    }

    public MapValue asMap() {
        return cast(MapValue.class);
    }

    private <T extends FieldValue> T cast(Class<T> cls) {
        if (!cls.isInstance(this)) {
            throw new ClassCastException(
                "Value of type " + getType() + " is not a " +
                cls.getSimpleName());
        }
        return cls.cast(this);
    }

    public boolean isNull() {
        return getType() == Type.NULL;
    }

    public boolean isInteger() {
        return getType() == Type.INTEGER;
    }

    public boolean isDouble() {
        return getType() == Type.DOUBLE;
    }

    public boolean isString() {
        return getType() == Type.STRING;
    }

    public boolean isBoolean() {
        return getType() == Type.BOOLEAN;
    }

    public boolean isBinary() {
        return getType() == Type.BINARY;
    }

    public boolean isTimestamp() {
        return getType() == Type.TIMESTAMP;
    }

    public boolean isArray() {
        return getType() == Type.ARRAY;
    }

    public boolean isMap() {
        return getType() == Type.MAP;
    }

    /**
     * @return true unless this is a map or an array
     */
    public boolean isAtomic() {
        return !isMap() && !isArray();
    }

    /**
     * Returns a value equal to this one that shares no mutable state with
     * it. Atomic values are immutable and return themselves; containers
     * return a deep copy.
     *
     * @return the copy
     */
    public FieldValue copy() {
        return this;
    }

    /**
     * Returns the value as compact JSON, map entries in entry order. See
     * {@link JsonSerializer} for the types JSON lacks. A NaN or infinite
     * double is written as a bare NaN or Infinity token, which
     * {@link #fromJson} accepts but strict JSON readers may not.
     *
     * @return the JSON string
     */
    public String toJson() {
        return render(new JsonSerializer(), false);
    }

    /**
     * Returns the canonical string of this value. Equal values have equal
     * canonical strings; map keys are emitted in sorted order, so entry
     * order does not matter.
     *
     * @return the canonical string
     */
    public String canonicalId() {
        return render(new CanonicalIdSerializer(), true);
    }

    private String render(TextSerializer serializer, boolean sortKeys) {
        FieldValueEventHandler.generate(this, serializer, sortKeys);
        return serializer.toString();
    }

    /**
     * Returns the JSON form of the value.
     */
    @Override
    public String toString() {
        return toJson();
    }

    /**
     * Creates a value from JSON text. TIMESTAMP, BINARY, REFERENCE and
     * GEO_POINT values are never created; their JSON forms read back as
     * strings and maps.
     *
     * @param json the JSON text, a single JSON value
     * @return the value
     *
     * @throws io.docvalue.JsonParseException if the text is not valid JSON
     */
    public static FieldValue fromJson(String json) {
        return JsonValueParser.parse(json);
    }
}
