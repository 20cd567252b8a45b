package com.framegate.domain.frame.service;

import com.framegate.domain.frame.exception.PackagingException;
import com.framegate.domain.frame.model.AtlasFrame;
import com.framegate.domain.frame.model.PackedAtlas;

import java.util.List;

/**
 * External atlas packer. Invoked only once every frame of a run is approved.
 */
public interface PackerAdapter {

    /**
     * @param frames approved frames in frame order, named {@code {moveId}/{0000}}
     * @throws PackagingException when packing fails
     */
    PackedAtlas pack(List<AtlasFrame> frames);
}
