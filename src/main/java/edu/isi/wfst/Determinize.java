package edu.isi.wfst;

import java.util.Date;

/**
 * Weighted determinization. The result has at most one transition per input label
 * leaving each state and the same weighted relation as the input, when that relation
 * allows it.
 *
 * Acceptors run the subset construction directly. Transducers are turned into gallic
 * acceptors first; the determinization type picks the gallic flavour:
 * <ul>
 * <li>FUNCTIONAL: restricted gallic, fails with {@link NonDeterminizableException} if
 * some input has two different outputs</li>
 * <li>DISAMBIGUATE: min gallic, keeps only the best output per input; needs a path semiring</li>
 * <li>NON_FUNCTIONAL: union gallic, keeps every output; may not terminate, so consider
 * a state limit</li>
 * </ul>
 */
public class Determinize {

	/** lazy determinization of an acceptor */
	public static <W> LazyFst<W> lazy(Fst<W> fst, DeterminizeConfig config) throws ConfigureException {
		checkSemiring(fst.getSemiring());
		DeterminizeFsaOp<W> op = new DeterminizeFsaOp<W>(fst, new DefaultCommonDivisor<W>(fst.getSemiring()), config);
		return new LazyFst<W>(fst.getSemiring(), op, config.getCacheOptions(), fst.getInputSymbols(), fst.getOutputSymbols());
	}

	public static <W> VectorFst<W> determinize(ExpandedFst<W> fst) throws FstException {
		return determinize(fst, new DeterminizeConfig());
	}

	public static <W> VectorFst<W> determinize(ExpandedFst<W> fst, DeterminizeConfig config) throws FstException {
		boolean debug = false;
		Date startTime = new Date();
		Semiring<W> sr = fst.getSemiring();
		checkSemiring(sr);
		VectorFst<W> ret;
		if (Fsts.isAcceptor(fst)) {
			if (debug) Debug.debug(debug, "Determinizing acceptor with "+fst.numStates()+" states");
			ret = lazy(fst, config).expand();
		}
		else {
			if (debug) Debug.debug(debug, "Determinizing "+config.getType()+" transducer with "+fst.numStates()+" states");
			switch (config.getType()) {
			case DISAMBIGUATE:
				if (!sr.hasProperties(Semiring.PATH))
					throw new ConfigureException("Disambiguating determinization needs a path semiring, not "+sr);
				ret = determinizeTransducer(fst, new GallicSemiring<W>(sr, GallicType.MIN), config);
				break;
			case NON_FUNCTIONAL:
				ret = determinizeTransducer(fst, new GallicUnionSemiring<W>(sr), config);
				break;
			case FUNCTIONAL:
			default:
				ret = determinizeTransducer(fst, new GallicSemiring<W>(sr, GallicType.RESTRICT), config);
			}
		}
		Debug.dbtime(1, startTime, "determinized into "+ret.numStates()+" states");
		return ret;
	}

	private static <W> void checkSemiring(Semiring<W> sr) throws ConfigureException {
		if (!sr.isDivisible() || !sr.hasProperties(Semiring.LEFT_SEMIRING))
			throw new ConfigureException("Determinization needs a left semiring with division, not "+sr);
	}

	private static <G, W> VectorFst<W> determinizeTransducer(ExpandedFst<W> fst, GallicAlgebra<G, W> algebra, DeterminizeConfig config) throws FstException {
		VectorFst<G> gfst = GallicConvert.toGallic(fst, algebra);
		DeterminizeFsaOp<G> op = new DeterminizeFsaOp<G>(gfst, new GallicCommonDivisor<G, W>(algebra), config);
		VectorFst<G> det = new LazyFst<G>(algebra.getSemiring(), op, config.getCacheOptions(), null, null).expand();
		FactorWeightConfig fconfig = new FactorWeightConfig()
			.setDelta(config.getDelta())
			.setFactorTransitionWeights(false)
			.setFinalILabel(config.getSubsequentialLabel());
		VectorFst<G> factored = FactorWeight.factorWeight(det, new GallicFactor<G, W>(algebra), fconfig);
		VectorFst<W> ret = GallicConvert.fromGallic(factored, algebra, fst.getOutputSymbols(), config.getSubsequentialLabel());
		ret.setInputSymbols(fst.getInputSymbols());
		return ret;
	}
}
