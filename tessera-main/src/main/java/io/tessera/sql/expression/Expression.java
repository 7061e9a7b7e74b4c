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
package io.tessera.sql.expression;

import com.fasterxml.jackson.annotation.JsonValue;
import io.airlift.slice.Slice;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.StatementContext;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A node of a value-producing expression tree.
 * <p>
 * The set of node kinds is closed: {@link ColumnReference}, {@link CorrelatedColumnReference},
 * {@link Constant} and {@link ScalarFunction}. Trees are built and rewritten during planning,
 * which is single threaded, and are read-only during execution, when any number of threads
 * may evaluate the same tree on disjoint batches.
 * <p>
 * Typed accessors return the native container of their category, or {@code null} for SQL NULL.
 * Evaluation errors are thrown as {@link io.tessera.spi.TesseraException}.
 */
public abstract class Expression
{
    Expression() {}

    public abstract FieldType getType();

    /**
     * Evaluates this expression for one row and returns the value boxed according to the
     * declared type, or {@code null}.
     */
    public abstract Object evaluate(Row row);

    public abstract Long evalInt(Row row);

    public abstract Double evalReal(Row row);

    public abstract Slice evalString(Row row);

    public abstract BigDecimal evalDecimal(Row row);

    public abstract LocalDateTime evalTime(Row row);

    public abstract Duration evalDuration(Row row);

    /**
     * Evaluates this expression for every row of {@code input}, writing one value per row into {@code result}.
     */
    public abstract void vecEvalInt(Chunk input, ColumnVector result);

    public abstract void vecEvalReal(Chunk input, ColumnVector result);

    public abstract void vecEvalString(Chunk input, ColumnVector result);

    public abstract void vecEvalDecimal(Chunk input, ColumnVector result);

    public abstract void vecEvalTime(Chunk input, ColumnVector result);

    public abstract void vecEvalDuration(Chunk input, ColumnVector result);

    /**
     * Whether every node of this tree can be evaluated by the {@code vecEval*} methods.
     */
    public abstract boolean isVectorized();

    /**
     * Structural hash of this tree. Two trees with the same structure produce the same
     * bytes; the encoding is sensitive to argument order. The returned array must not be modified.
     */
    public abstract byte[] getHashCode(StatementContext context);

    /**
     * Whether this tree produces the same value for every row of a statement,
     * and so may be evaluated once and replaced by a literal.
     */
    public abstract boolean isConstant();

    /**
     * Whether this tree references a column of an enclosing query.
     */
    public abstract boolean isCorrelated();

    /**
     * Replaces correlated columns that belong to {@code schema} by plain column references.
     * Function nodes are rewritten in place and returned; callers that need the original
     * tree must {@link #copy()} it first.
     */
    public abstract Expression decorrelate(Schema schema);

    /**
     * Returns a copy of this tree whose column references are bound to their offset in
     * {@code schema}. This expression is left unchanged, so it can be bound to several
     * schemas. If a column is missing a {@code COLUMN_NOT_FOUND} error is thrown and the
     * partially bound copy is discarded.
     */
    public abstract Expression resolveIndices(Schema schema);

    /**
     * Binds the column references of this tree to {@code schema}, modifying this tree.
     */
    abstract void resolveIndicesInPlace(Schema schema);

    /**
     * Returns a copy of this tree. Function nodes and column bindings of the copy can be
     * rewritten without affecting this tree; bound outer values of correlated columns are shared.
     */
    public abstract Expression copy();

    @JsonValue
    @Override
    public abstract String toString();
}
