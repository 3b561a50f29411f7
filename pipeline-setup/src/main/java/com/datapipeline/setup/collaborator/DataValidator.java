package com.datapipeline.setup.collaborator;

@FunctionalInterface
public interface DataValidator {
  DataValidationReport validate() throws Exception;
}
