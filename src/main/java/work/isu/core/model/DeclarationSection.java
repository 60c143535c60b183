package work.isu.core.model;

/**
 * Sections that may declare variables, in the order duplicate checks walk them.
 */
public enum DeclarationSection {
    INPUT,
    OUTPUT,
    STATE,
    LOCAL
}
