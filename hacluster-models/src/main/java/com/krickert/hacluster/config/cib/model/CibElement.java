package com.krickert.hacluster.config.cib.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A node of the cluster information base tree. Children are owned by their parent, the parent
 * reference is a back link used for ancestor lookups only.
 */
public final class CibElement {

    public static final String ID = "id";

    private final String tag;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<CibElement> children = new ArrayList<>();
    private final CibElement parent;

    private CibElement(String tag, CibElement parent) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("CibElement tag cannot be null or blank.");
        }
        this.tag = tag;
        this.parent = parent;
    }

    public static CibElement root(String tag) {
        return new CibElement(tag, null);
    }

    public CibElement appendChild(String childTag) {
        CibElement child = new CibElement(childTag, this);
        children.add(child);
        return child;
    }

    public CibElement appendChild(String childTag, Map<String, String> childAttributes) {
        return appendChild(childTag).setAttributes(childAttributes);
    }

    public CibElement setAttribute(String name, String value) {
        Objects.requireNonNull(name, "attribute name cannot be null");
        Objects.requireNonNull(value, "value of attribute '" + name + "' cannot be null");
        attributes.put(name, value);
        return this;
    }

    public CibElement setAttributes(Map<String, String> newAttributes) {
        if (newAttributes != null) {
            newAttributes.forEach(this::setAttribute);
        }
        return this;
    }

    public String getTag() {
        return tag;
    }

    public Optional<String> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * @return the id attribute or null if the element has none
     */
    public String getId() {
        return attributes.get(ID);
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<CibElement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Optional<CibElement> getParent() {
        return Optional.ofNullable(parent);
    }

    public CibElement getRoot() {
        CibElement current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * All elements below this one in document order, this element excluded.
     */
    public Stream<CibElement> descendants() {
        return children.stream().flatMap(child -> Stream.concat(Stream.of(child), child.descendants()));
    }

    public List<CibElement> findDescendants(String descendantTag) {
        return descendants().filter(element -> element.tag.equals(descendantTag)).toList();
    }

    public Optional<CibElement> findFirstDescendant(String descendantTag) {
        return descendants().filter(element -> element.tag.equals(descendantTag)).findFirst();
    }

    /**
     * Looks up an element by id in the whole tree this element belongs to.
     */
    public Optional<CibElement> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        CibElement root = getRoot();
        return Stream.concat(Stream.of(root), root.descendants())
                .filter(element -> id.equals(element.getId()))
                .findFirst();
    }

    public Optional<CibElement> findById(String id, Set<String> tags) {
        return findById(id).filter(element -> tags.contains(element.tag));
    }

    public boolean idExists(String id) {
        return findById(id).isPresent();
    }

    /**
     * Nearest ancestor whose tag is one of the given tags. The element itself is not considered.
     */
    public Optional<CibElement> findNearestAncestor(Set<String> tags) {
        CibElement current = parent;
        while (current != null) {
            if (tags.contains(current.tag)) {
                return Optional.of(current);
            }
            current = current.parent;
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "CibElement{" + tag + attributes + "}";
    }
}
