package com.staycheckout.checkout.domain.service;

import com.staycheckout.checkout.domain.model.Property;
import com.staycheckout.checkout.domain.model.PropertyReference;
import com.staycheckout.checkout.domain.repository.PropertyRepository;
import com.staycheckout.common.result.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Resolves a property by id or slug. The id wins when both are given; a reference with
 * neither resolves to not found.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PropertyLookup {

    static final String PROPERTY_NOT_FOUND = "property not found";

    private final PropertyRepository propertyRepository;

    @Transactional(readOnly = true)
    public Result<Property> find(PropertyReference reference) {
        Optional<Property> property;
        if (reference.hasId()) {
            property = propertyRepository.findById(reference.id());
        } else if (reference.hasSlug()) {
            property = propertyRepository.findBySlug(reference.slug().trim());
        } else {
            property = Optional.empty();
        }
        return property.map(Result::success)
                .orElseGet(() -> {
                    log.debug("Property not found for {}", reference);
                    return Result.notFound(PROPERTY_NOT_FOUND);
                });
    }
}
