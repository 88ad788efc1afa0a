package org.hwir.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A fixed-point number type: a range of values together with a binary point,
 * the number of fractional bits.  A value v of this type is represented by the
 * integer v * 2^point.
 */
public class HwTypeInterval extends HwType {
    public final IntervalBound lower;
    public final IntervalBound upper;
    /** Null when the binary point has not been inferred yet. */
    @Nullable
    public final Integer point;

    public HwTypeInterval(SourceInfo info, IntervalBound lower, IntervalBound upper, @Nullable Integer point) {
        super(info);
        this.lower = lower;
        this.upper = upper;
        this.point = point;
        if (point != null && point < 0)
            throw this.error("Negative binary point " + point);
    }

    public HwTypeInterval(IntervalBound lower, IntervalBound upper, @Nullable Integer point) {
        this(SourceInfo.EMPTY, lower, upper, point);
    }

    public HwTypeInterval(String lower, String upper, int point) {
        this(IntervalBound.known(lower), IntervalBound.known(upper), point);
    }

    public boolean hasKnownPoint() {
        return this.point != null;
    }

    public boolean hasKnownBounds() {
        return this.lower.isKnown() && this.upper.isKnown();
    }

    public int getPoint() {
        if (this.point == null)
            throw this.error("Interval type " + this + " has an unknown binary point");
        return this.point;
    }

    void checkBounds() {
        if (!this.hasKnownBounds())
            throw this.error("Interval type " + this + " has an open bound");
    }

    /** Lower bound encoded at this type's binary point. */
    public BigInteger adjustedLower() {
        this.checkBounds();
        return this.lower.adjusted(this.getPoint());
    }

    /** Upper bound encoded at this type's binary point. */
    public BigInteger adjustedUpper() {
        this.checkBounds();
        return this.upper.adjusted(this.getPoint());
    }

    /** Number of bits of a two's complement integer holding
     * every adjusted value in the range. */
    public int intrinsicWidth() {
        int lo = this.adjustedLower().bitLength();
        int hi = this.adjustedUpper().bitLength();
        return Math.max(lo, hi) + 1;
    }

    /** Same range with a different binary point. */
    public HwTypeInterval withPoint(int point) {
        if (this.point != null && this.point == point)
            return this;
        return new HwTypeInterval(this.sourceInfo, this.lower, this.upper, point);
    }

    @Override
    public boolean sameType(HwType other) {
        HwTypeInterval o = other.as(HwTypeInterval.class);
        if (o == null)
            return false;
        return this.lower.same(o.lower) &&
                this.upper.same(o.upper) &&
                Objects.equals(this.point, o.point);
    }

    @Override
    public int hashCode() {
        return Objects.hash(boundHash(this.lower), boundHash(this.upper), this.point);
    }

    /** Hash consistent with {@link IntervalBound#same}: 1.0 and 1 hash alike. */
    static int boundHash(IntervalBound bound) {
        if (!bound.isKnown())
            return 0;
        return bound.getValue().stripTrailingZeros().hashCode();
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Interval[")
                .append(this.lower.toString())
                .append(", ")
                .append(this.upper.toString())
                .append("].")
                .append(this.point == null ? "?" : this.point.toString());
    }

    @SuppressWarnings("unused")
    public static HwTypeInterval fromJson(JsonNode node, JsonDecoder decoder) {
        IntervalBound lower = IntervalBound.fromJsonString(Utilities.getStringProperty(node, "lower"));
        IntervalBound upper = IntervalBound.fromJsonString(Utilities.getStringProperty(node, "upper"));
        Integer point = null;
        JsonNode pointNode = node.get("point");
        if (pointNode != null && !pointNode.isNull())
            point = pointNode.asInt();
        return new HwTypeInterval(lower, upper, point);
    }
}
