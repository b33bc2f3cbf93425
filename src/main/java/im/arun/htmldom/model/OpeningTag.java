package im.arun.htmldom.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Information carried by an opening tag.
 */
@EqualsAndHashCode
@ToString
public final class OpeningTag {

    @Getter
    private String name;

    @Getter
    private final boolean selfClosing;

    private final List<Attribute> attrs;

    public OpeningTag(String name, boolean selfClosing, List<Attribute> attrs) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        this.name = name;
        this.selfClosing = selfClosing;
        this.attrs = new ArrayList<>(attrs);
    }

    /**
     * Attributes in source order.
     */
    public List<Attribute> getAttributes() {
        return Collections.unmodifiableList(attrs);
    }

    OpeningTag copy() {
        return new OpeningTag(name, selfClosing, attrs);
    }

    void setName(String name) {
        this.name = name;
    }

    List<Attribute> mutableAttributes() {
        return attrs;
    }
}
