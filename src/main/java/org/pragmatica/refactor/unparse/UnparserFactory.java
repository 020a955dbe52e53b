package org.pragmatica.refactor.unparse;

import org.jetbrains.annotations.Nullable;

/**
 * Creates the unparser used for one source snapshot. Custom unparsers are plugged in through this interface,
 * usually as a constructor reference of a {@link BaseUnparser} subclass.
 */
@FunctionalInterface
public interface UnparserFactory {
    BaseUnparser create(@Nullable String source);
}
