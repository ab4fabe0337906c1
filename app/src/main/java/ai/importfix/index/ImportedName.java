package ai.importfix.index;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

/**
 * One name a file imports from a module: {@code value} is the imported member, or null when the module itself is
 * imported; {@code asName} is the {@code as} binding, if any.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"value", "asName"})
public record ImportedName(@Nullable String value, @Nullable String asName) {}
