package com.datapipeline.setup.collaborator;

/** Uploads and transforms local images. The result is opaque to the pipeline and stored as-is. */
@FunctionalInterface
public interface ImageProcessor {
  Object processImages(CollaboratorRequest request) throws Exception;
}
