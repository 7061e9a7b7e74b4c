/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tessera.spi.block;

import io.airlift.slice.Slice;
import io.tessera.spi.type.EvalType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Mutable column of values of a single {@link EvalType}. Used both as the input
 * columns of a {@link Chunk} and as the output buffer of vectorized evaluation.
 * <p>
 * INT values are stored as {@code long} (unsigned values keep their bit pattern),
 * REAL values as {@code double}; every other category is stored as an object:
 * {@link Slice} for STRING and JSON, {@link BigDecimal}, {@link LocalDateTime} and
 * {@link Duration}.
 * <p>
 * Not thread safe.
 */
public final class ColumnVector
{
    private static final int INITIAL_CAPACITY = 32;

    private final EvalType evalType;
    private int positionCount;
    private long[] longs;
    private double[] doubles;
    private Object[] objects;
    private boolean[] nulls;

    public ColumnVector(EvalType evalType, int positionCount)
    {
        this.evalType = requireNonNull(evalType, "evalType is null");
        if (positionCount < 0) {
            throw new IllegalArgumentException("positionCount is negative");
        }
        allocate(Math.max(positionCount, INITIAL_CAPACITY));
        this.positionCount = positionCount;
    }

    public static ColumnVector ofLongs(Long... values)
    {
        ColumnVector vector = new ColumnVector(EvalType.INT, values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                vector.setNull(i);
            }
            else {
                vector.setLong(i, values[i]);
            }
        }
        return vector;
    }

    public static ColumnVector ofDoubles(Double... values)
    {
        ColumnVector vector = new ColumnVector(EvalType.REAL, values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                vector.setNull(i);
            }
            else {
                vector.setDouble(i, values[i]);
            }
        }
        return vector;
    }

    public static ColumnVector ofObjects(EvalType evalType, Object... values)
    {
        if (evalType == EvalType.INT || evalType == EvalType.REAL) {
            throw new IllegalArgumentException(format("%s values are not stored as objects", evalType));
        }
        ColumnVector vector = new ColumnVector(evalType, values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                vector.setNull(i);
            }
            else {
                vector.setObject(i, values[i]);
            }
        }
        return vector;
    }

    public EvalType getEvalType()
    {
        return evalType;
    }

    public int getPositionCount()
    {
        return positionCount;
    }

    /**
     * Resizes the vector to {@code positionCount} positions and clears every null flag.
     * Values from a previous use are not cleared.
     */
    public void reset(int positionCount)
    {
        if (positionCount < 0) {
            throw new IllegalArgumentException("positionCount is negative");
        }
        if (positionCount > nulls.length) {
            allocate(Math.max(positionCount, nulls.length * 2));
        }
        else {
            Arrays.fill(nulls, 0, positionCount, false);
        }
        this.positionCount = positionCount;
    }

    public boolean isNull(int position)
    {
        checkPosition(position);
        return nulls[position];
    }

    public boolean mayHaveNull()
    {
        for (int i = 0; i < positionCount; i++) {
            if (nulls[i]) {
                return true;
            }
        }
        return false;
    }

    public void setNull(int position)
    {
        checkPosition(position);
        nulls[position] = true;
    }

    /**
     * Marks every position that is null in any of {@code others} as null in this vector.
     */
    public void mergeNulls(ColumnVector... others)
    {
        for (ColumnVector other : others) {
            if (other.positionCount != positionCount) {
                throw new IllegalArgumentException(format("Expected %s positions, but vector has %s", positionCount, other.positionCount));
            }
            for (int i = 0; i < positionCount; i++) {
                nulls[i] |= other.nulls[i];
            }
        }
    }

    /**
     * Resets {@code target} to the size of this vector and copies every value and null flag into it.
     */
    public void copyInto(ColumnVector target)
    {
        if (target.evalType != evalType) {
            throw new IllegalStateException(format("Cannot copy %s vector into %s vector", evalType, target.evalType));
        }
        target.reset(positionCount);
        switch (evalType) {
            case INT:
                System.arraycopy(longs, 0, target.longs, 0, positionCount);
                break;
            case REAL:
                System.arraycopy(doubles, 0, target.doubles, 0, positionCount);
                break;
            default:
                System.arraycopy(objects, 0, target.objects, 0, positionCount);
        }
        System.arraycopy(nulls, 0, target.nulls, 0, positionCount);
    }

    public long getLong(int position)
    {
        checkPosition(position);
        checkEvalType(EvalType.INT);
        return longs[position];
    }

    public void setLong(int position, long value)
    {
        checkPosition(position);
        checkEvalType(EvalType.INT);
        longs[position] = value;
        nulls[position] = false;
    }

    public double getDouble(int position)
    {
        checkPosition(position);
        checkEvalType(EvalType.REAL);
        return doubles[position];
    }

    public void setDouble(int position, double value)
    {
        checkPosition(position);
        checkEvalType(EvalType.REAL);
        doubles[position] = value;
        nulls[position] = false;
    }

    public Slice getSlice(int position)
    {
        return (Slice) getObjectValue(position, EvalType.STRING, EvalType.JSON);
    }

    public void setSlice(int position, Slice value)
    {
        setObjectValue(position, value, EvalType.STRING, EvalType.JSON);
    }

    public BigDecimal getDecimal(int position)
    {
        return (BigDecimal) getObjectValue(position, EvalType.DECIMAL, EvalType.DECIMAL);
    }

    public void setDecimal(int position, BigDecimal value)
    {
        setObjectValue(position, value, EvalType.DECIMAL, EvalType.DECIMAL);
    }

    public LocalDateTime getTimestamp(int position)
    {
        return (LocalDateTime) getObjectValue(position, EvalType.DATETIME, EvalType.DATETIME);
    }

    public void setTimestamp(int position, LocalDateTime value)
    {
        setObjectValue(position, value, EvalType.DATETIME, EvalType.DATETIME);
    }

    public Duration getDuration(int position)
    {
        return (Duration) getObjectValue(position, EvalType.DURATION, EvalType.DURATION);
    }

    public void setDuration(int position, Duration value)
    {
        setObjectValue(position, value, EvalType.DURATION, EvalType.DURATION);
    }

    /**
     * Returns the value at {@code position} in its native container, or {@code null}.
     */
    public Object getObject(int position)
    {
        if (isNull(position)) {
            return null;
        }
        switch (evalType) {
            case INT:
                return longs[position];
            case REAL:
                return doubles[position];
            default:
                return objects[position];
        }
    }

    private void setObject(int position, Object value)
    {
        checkPosition(position);
        objects[position] = requireNonNull(value, "value is null");
        nulls[position] = false;
    }

    private Object getObjectValue(int position, EvalType expected, EvalType alternative)
    {
        checkPosition(position);
        if (evalType != expected && evalType != alternative) {
            throw new IllegalStateException(format("Cannot read %s value from %s vector", expected, evalType));
        }
        return objects[position];
    }

    private void setObjectValue(int position, Object value, EvalType expected, EvalType alternative)
    {
        if (evalType != expected && evalType != alternative) {
            throw new IllegalStateException(format("Cannot write %s value to %s vector", expected, evalType));
        }
        setObject(position, value);
    }

    private void allocate(int capacity)
    {
        switch (evalType) {
            case INT:
                longs = longs == null ? new long[capacity] : Arrays.copyOf(longs, capacity);
                break;
            case REAL:
                doubles = doubles == null ? new double[capacity] : Arrays.copyOf(doubles, capacity);
                break;
            default:
                objects = objects == null ? new Object[capacity] : Arrays.copyOf(objects, capacity);
        }
        nulls = new boolean[capacity];
    }

    private void checkEvalType(EvalType expected)
    {
        if (evalType != expected) {
            throw new IllegalStateException(format("Cannot access %s value in %s vector", expected, evalType));
        }
    }

    private void checkPosition(int position)
    {
        if (position < 0 || position >= positionCount) {
            throw new IndexOutOfBoundsException(format("Invalid position %s in vector with %s positions", position, positionCount));
        }
    }

    @Override
    public String toString()
    {
        return format("ColumnVector{evalType=%s, positionCount=%s}", evalType, positionCount);
    }
}
