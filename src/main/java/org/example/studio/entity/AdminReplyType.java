package org.example.studio.entity;

public enum AdminReplyType {
    REPLY,   // awaiting the customer's answer
    COMMENT  // kept on a resolved item as an informational note
}
