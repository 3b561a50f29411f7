package com.datapipeline.setup.collaborator;

@FunctionalInterface
public interface DatabaseSeeder {
  Object seedAll(CollaboratorRequest request) throws Exception;
}
