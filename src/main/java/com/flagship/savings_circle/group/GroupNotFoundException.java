package com.flagship.savings_circle.group;

import java.util.UUID;

public class GroupNotFoundException extends RuntimeException {

    public GroupNotFoundException(UUID groupId) {
        super("Group not found: " + groupId);
    }
}
