package edu.isi.wfst;

import java.util.ArrayList;

// turns a transducer into an acceptor of its input or output side
public class Project {
	private Project() {}

	public static <W> void project(MutableFst<W> fst, ProjectType type) {
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Transition<W>> l = new ArrayList<Transition<W>>(fst.numTransitions(s));
			for (Transition<W> t : fst.transitions(s)) {
				if (type == ProjectType.INPUT)
					l.add(t.withLabels(t.getILabel(), t.getILabel()));
				else
					l.add(t.withLabels(t.getOLabel(), t.getOLabel()));
			}
			fst.setTransitions(s, l);
		}
		if (type == ProjectType.INPUT)
			fst.setOutputSymbols(fst.getInputSymbols());
		else
			fst.setInputSymbols(fst.getOutputSymbols());
	}
}
