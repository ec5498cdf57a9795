package fol.formula;

public record PSymbol(String name, int arity) {
    public String toString() {
        return name + "\\" + arity;
    }
}
