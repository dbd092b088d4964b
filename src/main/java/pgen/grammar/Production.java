package pgen.grammar;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A grammar production with a left and a right hand side.
 */
public final class Production {

	/**
	 * Id of the production, its position in the grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for an epsilon production
	 */
	public final ImmutableList<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final ImmutableList<NonTerminal> nonTerminals;

	/**
	 * @param right right hand side, epsilons are dropped
	 */
	public Production(int id, NonTerminal left, List<? extends Symbol> right) {
		this.id = id;
		this.left = Objects.requireNonNull(left);
		ImmutableList.Builder<Symbol> r = ImmutableList.builder();
		ImmutableList.Builder<NonTerminal> nonTerminals = ImmutableList.builder();
		for (Symbol symbol : right){
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else if (((Terminal)symbol).isEpsilon()){
				continue;
			}
			r.add(symbol);
		}
		this.right = r.build();
		this.nonTerminals = nonTerminals.build();
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return Terminal.EPSILON.name;
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	/**
	 * Formats the production without its id
	 */
	public String format(){
		return left + " → " + formatRightSide();
	}

	@Override
	public String toString() {
		return id + " " + format();
	}

	/**
	 * Is the right hand side empty?
	 */
	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return other.id == id && other.left.equals(left) && other.right.equals(right);
	}

	@Override
	public int hashCode() {
		return 31 * id + left.hashCode();
	}
}
