package org.hwir.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;
import org.hwir.util.Linq;

import javax.annotation.Nullable;
import java.util.List;

/** A record type with named, possibly flipped, fields. */
public class HwTypeBundle extends HwType {
    public final List<HwField> fields;

    public HwTypeBundle(SourceInfo info, List<HwField> fields) {
        super(info);
        this.fields = fields;
    }

    public HwTypeBundle(HwField... fields) {
        this(SourceInfo.EMPTY, Linq.list(fields));
    }

    @Nullable
    public HwField getField(String name) {
        for (HwField field: this.fields)
            if (field.name.equals(name))
                return field;
        return null;
    }

    @Override
    public boolean containsInterval() {
        return Linq.any(this.fields, f -> f.type.containsInterval());
    }

    @Override
    public boolean sameType(HwType other) {
        HwTypeBundle o = other.as(HwTypeBundle.class);
        if (o == null)
            return false;
        if (this.fields.size() != o.fields.size())
            return false;
        for (int i = 0; i < this.fields.size(); i++)
            if (!this.fields.get(i).sameField(o.fields.get(i)))
                return false;
        return true;
    }

    @Override
    public int hashCode() {
        return this.fields.size();
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("fields");
        int index = 0;
        for (HwField field: this.fields) {
            visitor.propertyIndex(index);
            index++;
            field.accept(visitor);
        }
        visitor.endArrayProperty("fields");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("{")
                .joinI(", ", this.fields)
                .append("}");
    }

    @SuppressWarnings("unused")
    public static HwTypeBundle fromJson(JsonNode node, JsonDecoder decoder) {
        List<HwField> fields = fromJsonInnerList(node, "fields", decoder, HwField.class);
        return new HwTypeBundle(SourceInfo.EMPTY, fields);
    }
}
