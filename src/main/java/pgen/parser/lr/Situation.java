package pgen.parser.lr;

import pgen.grammar.NonTerminal;
import pgen.grammar.Production;
import pgen.grammar.Symbol;
import pgen.grammar.Terminal;

/**
 * An LR(0) item: a production with a dot that marks how much of its right hand side is recognized.
 */
public final class Situation implements Comparable<Situation> {

	public final Production production;

	/**
	 * The dot is before the $position.th right hand side symbol
	 */
	public final int position;

	public Situation(Production production, int position) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException(String.format("Invalid dot position %d for %s", position, production));
		}
		this.production = production;
		this.position = position;
	}

	public Situation(Production production){
		this(production, 0);
	}

	public boolean canAdvance(){
		return position < production.rightSize();
	}

	public Situation advance(){
		if (!canAdvance()){
			throw new IllegalStateException("Can't advance " + this);
		}
		return new Situation(production, position + 1);
	}

	/**
	 * Symbol after the dot or epsilon if the dot is at the end
	 */
	public Symbol nextSymbol(){
		if (canAdvance()){
			return production.right.get(position);
		}
		return Terminal.EPSILON;
	}

	public boolean inFrontOfTerminal(){
		return canAdvance() && nextSymbol() instanceof Terminal;
	}

	public boolean inFrontOfNonTerminal(){
		return nextSymbol() instanceof NonTerminal;
	}

	public boolean inFrontOf(Symbol symbol){
		return canAdvance() && nextSymbol().equals(symbol);
	}

	/**
	 * Is the production completely recognized?
	 */
	public boolean atEnd(){
		return !canAdvance();
	}

	public String formatRightSide() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < position; i++) {
			builder.append(production.right.get(i)).append(" ");
		}
		builder.append("·");
		for (int i = position; i < production.rightSize(); i++) {
			builder.append(" ").append(production.right.get(i));
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return production.id + " " + production.left + " → " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Situation && ((Situation)obj).position == position
				&& ((Situation)obj).production.equals(production);
	}

	@Override
	public int hashCode() {
		return 31 * production.id + position;
	}

	/**
	 * Items with a dot behind the first symbol come first, then the items are ordered by production and dot
	 * position.
	 */
	@Override
	public int compareTo(Situation o) {
		if (position == 0 && o.position != 0){
			return 1;
		}
		if (position != 0 && o.position == 0){
			return -1;
		}
		if (o.production.id != production.id){
			return Integer.compare(production.id, o.production.id);
		}
		return Integer.compare(position, o.position);
	}
}
