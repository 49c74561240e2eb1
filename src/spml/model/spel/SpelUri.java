package spml.model.spel;

public interface SpelUri extends SpelElement {
}
