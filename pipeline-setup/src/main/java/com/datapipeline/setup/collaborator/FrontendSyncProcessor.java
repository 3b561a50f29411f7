package com.datapipeline.setup.collaborator;

/** Generates frontend mock data from the backend records. */
@FunctionalInterface
public interface FrontendSyncProcessor {
  Object syncMockData(CollaboratorRequest request) throws Exception;
}
