package pgen.grammar;

import java.util.Objects;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Two symbols are equal if they are of the same kind and have the same name.
 */
public abstract class Symbol implements Comparable<Symbol> {

	/**
	 * Name of the symbol
	 */
	public final String name;

	protected Symbol(String name) {
		this.name = Objects.requireNonNull(name);
	}

	public boolean isTerminal(){
		return this instanceof Terminal;
	}

	public boolean isNonTerminal(){
		return this instanceof NonTerminal;
	}

	@Override
	public int hashCode() {
		return isTerminal() ? name.hashCode() : ~name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == getClass() && ((Symbol)obj).name.equals(name);
	}

	/**
	 * Non terminals come before terminals, symbols of the same kind are ordered by name.
	 */
	@Override
	public int compareTo(Symbol o) {
		if (isTerminal() != o.isTerminal()){
			return isTerminal() ? 1 : -1;
		}
		return name.compareTo(o.name);
	}

	@Override
	public String toString() {
		return name;
	}
}
