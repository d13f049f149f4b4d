package com.phillippitts.speaktoavatar.service.client.avatar;

/** Avatar rendering model offered by the live service. */
public enum AvatarType {
    PIC("pic"),
    THREE_MIN("3min");

    private final String wireName;

    AvatarType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name, falling back to {@link #THREE_MIN} when blank.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static AvatarType fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return THREE_MIN;
        }
        for (AvatarType t : values()) {
            if (t.wireName.equalsIgnoreCase(name.trim())) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown avatar type: " + name);
    }
}
