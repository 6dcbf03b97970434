package com.personal.shelter_editor.schema;

/**
 * Where the editable sections live inside a save document.
 * Resident paths are relative to one entry of {@link #RESIDENTS}.
 */
public final class SaveLayout {

    public static final FieldPath VAULT = FieldPath.of("vault");
    public static final FieldPath VAULT_NAME = FieldPath.of("vault", "VaultName");
    public static final FieldPath VAULT_MODE = FieldPath.of("vault", "VaultMode");
    public static final FieldPath VAULT_THEME = FieldPath.of("vault", "VaultTheme");
    public static final FieldPath RESOURCES = FieldPath.of("vault", "storage", "resources");

    public static final FieldPath RESIDENTS = FieldPath.of("dwellers", "dwellers");

    public static final FieldPath RESIDENT_NAME = FieldPath.of("name");
    public static final FieldPath RESIDENT_LAST_NAME = FieldPath.of("lastName");
    public static final FieldPath RESIDENT_GENDER = FieldPath.of("gender");
    public static final FieldPath RESIDENT_PREGNANT = FieldPath.of("relations", "pregnant");
    public static final FieldPath RESIDENT_SPECIAL = FieldPath.of("serializeableSpecialStats", "stats");

    private SaveLayout() {}
}
