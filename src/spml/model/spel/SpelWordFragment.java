package spml.model.spel;

public interface SpelWordFragment extends SpelElement {
}
