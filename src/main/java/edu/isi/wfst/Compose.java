package edu.isi.wfst;

import java.util.Date;

/**
 * Composition of two transducers: a path of the result reads an input of the first and
 * writes an output of the second, through a middle string the first writes and the
 * second reads. The weight of a result path is the product of the weights of the two
 * paths it pairs.
 *
 * At least one of the arguments must be sorted on the shared side: the first by output
 * label or the second by input label (see {@link TransitionSort}).
 */
public class Compose {

	public static <W> LazyFst<W> composeLazy(Fst<W> fst1, Fst<W> fst2) throws FstException {
		return composeLazy(fst1, fst2, new ComposeConfig());
	}

	public static <W> LazyFst<W> composeLazy(Fst<W> fst1, Fst<W> fst2, ComposeConfig config) throws FstException {
		if (!fst1.getSemiring().getName().equals(fst2.getSemiring().getName()))
			throw new ConfigureException("Can't compose over different semirings: "+fst1.getSemiring()+" and "+fst2.getSemiring());
		Fsts.mergeSymbols(fst1.getOutputSymbols(), fst2.getInputSymbols(), "output symbols of the first and input symbols of the second");
		switch (config.getFilterType()) {
		case NULL:
			return build(fst1, fst2, new NullComposeFilter<W>(fst1.getSemiring()), config);
		case TRIVIAL:
			return build(fst1, fst2, new TrivialComposeFilter<W>(fst1.getSemiring()), config);
		case ALT_SEQUENCE:
			return build(fst1, fst2, new AltSequenceComposeFilter<W>(fst2), config);
		case MATCH:
			return build(fst1, fst2, new MatchComposeFilter<W>(fst1, fst2), config);
		case NO_MATCH:
			return build(fst1, fst2, new NoMatchComposeFilter<W>(fst1.getSemiring()), config);
		case SEQUENCE:
		case AUTO:
		default:
			return build(fst1, fst2, new SequenceComposeFilter<W>(fst1), config);
		}
	}

	private static <W, F extends FilterState> LazyFst<W> build(Fst<W> fst1, Fst<W> fst2, ComposeFilter<W, F> filter, ComposeConfig config) throws ConfigureException {
		ComposeFstOp<W, F> op = new ComposeFstOp<W, F>(fst1, fst2, filter);
		return new LazyFst<W>(fst1.getSemiring(), op, config.getCacheOptions(), fst1.getInputSymbols(), fst2.getOutputSymbols());
	}

	public static <W> VectorFst<W> compose(Fst<W> fst1, Fst<W> fst2) throws FstException {
		return compose(fst1, fst2, new ComposeConfig());
	}

	/** the whole composition, expanded; trimmed to useful states if the config asks */
	public static <W> VectorFst<W> compose(Fst<W> fst1, Fst<W> fst2, ComposeConfig config) throws FstException {
		Date startTime = new Date();
		VectorFst<W> ret = composeLazy(fst1, fst2, config).expand();
		if (config.isConnect())
			Connect.connect(ret);
		Debug.dbtime(1, startTime, "composed into "+ret.numStates()+" states");
		return ret;
	}
}
