package spml.cst;

public enum NodeMovement {
	FIRST_CHILD,
	NEXT_SIBLING,
	CURRENT
}
