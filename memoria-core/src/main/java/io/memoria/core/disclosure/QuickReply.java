package io.memoria.core.disclosure;

public record QuickReply(String id, String label, String message, String icon) {
}
