package io.parlance.core.verb;

/// Grammatical slot a verb can fill.
///
/// `WHAT` is the direct object that follows the verb. The others are introduced
/// by the preposition of the same name.
public enum Role {
    WHAT,
    FROM,
    TO,
    USING,
    WITH
}
