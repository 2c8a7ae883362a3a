package com.scholary.videoengine.service;

/** No Video or Segment with the requested id. */
public class EntityNotFoundException extends RuntimeException {

  public EntityNotFoundException(String entityId) {
    super("No such entity: " + entityId);
  }
}
