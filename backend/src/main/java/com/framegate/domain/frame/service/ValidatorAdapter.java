package com.framegate.domain.frame.service;

import com.framegate.domain.frame.model.AtlasAssertion;
import com.framegate.domain.frame.model.AtlasValidationReport;
import com.framegate.domain.frame.model.PackedAtlas;

import java.util.Set;

/**
 * External structural validator for a packed atlas.
 */
public interface ValidatorAdapter {

    AtlasValidationReport validate(PackedAtlas atlas, Set<AtlasAssertion> assertions);
}
