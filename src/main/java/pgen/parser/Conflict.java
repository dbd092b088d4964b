package pgen.parser;

import java.util.Collection;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import pgen.grammar.Terminal;

import static pgen.util.Utils.join;

/**
 * A parser table cell with more than one entry. Conflicts are purely descriptive, the table that contains
 * the cell is built nonetheless.
 *
 * @param <R> type of the row key (non terminal for LL tables, state index for LR tables)
 * @param <E> type of the competing entries (productions or actions)
 */
public final class Conflict<R, E> {

	public enum Kind {
		/** More than one production predicted in an LL(1) table cell */
		LL1("LL(1)", TableKind.LL1),
		SHIFT_REDUCE("shift/reduce", TableKind.SLR1_ACTION),
		REDUCE_REDUCE("reduce/reduce", TableKind.SLR1_ACTION),
		ACCEPT_REDUCE("accept/reduce", TableKind.SLR1_ACTION);

		public final String description;

		public final TableKind table;

		Kind(String description, TableKind table) {
			this.description = description;
			this.table = table;
		}
	}

	public enum TableKind {
		LL1, SLR1_ACTION
	}

	public final Kind kind;

	/**
	 * Row of the conflicting cell
	 */
	public final R row;

	/**
	 * Lookahead terminal (column) of the conflicting cell
	 */
	public final Terminal lookahead;

	/**
	 * All entries of the cell, in insertion order
	 */
	public final ImmutableList<E> competing;

	public Conflict(Kind kind, R row, Terminal lookahead, Collection<? extends E> competing) {
		this.kind = Objects.requireNonNull(kind);
		this.row = Objects.requireNonNull(row);
		this.lookahead = Objects.requireNonNull(lookahead);
		this.competing = ImmutableList.copyOf(competing);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Conflict)){
			return false;
		}
		Conflict<?, ?> other = (Conflict<?, ?>)obj;
		return kind == other.kind && row.equals(other.row) && lookahead.equals(other.lookahead)
				&& competing.equals(other.competing);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, row, lookahead, competing);
	}

	@Override
	public String toString() {
		return String.format("%s conflict at [%s, %s]: %s", kind.description, row, lookahead,
				join(competing, " | "));
	}
}
