package com.staycheckout.checkout.domain.model;

/**
 * How a client points at a property: by id, by slug, or both (id wins).
 */
public record PropertyReference(Long id, String slug) {

    public boolean hasId() {
        return id != null;
    }

    public boolean hasSlug() {
        return slug != null && !slug.isBlank();
    }

    @Override
    public String toString() {
        return hasId() ? "id=" + id : "slug=" + slug;
    }
}
