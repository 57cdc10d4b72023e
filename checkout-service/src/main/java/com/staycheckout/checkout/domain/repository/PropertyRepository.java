package com.staycheckout.checkout.domain.repository;

import com.staycheckout.checkout.domain.model.Property;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PropertyRepository extends JpaRepository<Property, Long> {

    Optional<Property> findBySlug(String slug);

    /**
     * Locks the property row (SELECT FOR UPDATE) until the surrounding transaction ends.
     * Used to serialize booking attempts per property.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Property p WHERE p.id = :id")
    Optional<Property> findByIdWithLock(@Param("id") Long id);
}
