package com.mwpbound.analyzer.analysis;

import com.mwpbound.analyzer.relation.RelationList;

/**
 * Result of analysing one statement or statement list.
 *
 * @param index     next free choice index
 * @param relations relations of the statement
 * @param exit      true once every derivation is known to be infinite
 */
public record CommandResult(int index, RelationList relations, boolean exit) {

    static CommandResult skip(int index) {
        return new CommandResult(index, RelationList.empty(), false);
    }
}
