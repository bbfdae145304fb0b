package com.eainde.truckticket.reference;

import com.eainde.truckticket.model.ReferenceCategory;
import com.eainde.truckticket.model.ReferenceEntity;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the reference tables. Name matching is case-insensitive.
 */
public interface ReferenceDataSource {

    Optional<ReferenceEntity> findByName(ReferenceCategory category, String canonicalName);

    List<ReferenceEntity> findAll(ReferenceCategory category);
}
