package com.vireo.controller.fixtures;

import java.util.Map;

public interface UserRepository {
    Map<String, Object> find(String id);
}
