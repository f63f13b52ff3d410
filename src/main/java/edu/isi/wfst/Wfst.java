package edu.isi.wfst;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.FloatStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line front end: one algorithm per invocation, automata in and out as files
public class Wfst {
	public static final String VERSION = "1.0";

	// the commands, with how many automata each reads
	enum CMD { CONNECT(1), INVERT(1), MINIMIZE(1), ARCSORT(1), TOPSORT(1), PROJECT(1), SHORTESTPATH(1),
		REVERSE(1), RMEPSILON(1), DETERMINIZE(1), COMPOSE(2), PUSH(1), UNION(2), CONCAT(2), CLOSURE(1), OPTIMIZE(1), INFO(1) ;
		private final int inputs;
		private CMD(int inputs) {
			this.inputs = inputs;
		}
		public int getInputs() { return inputs; }
		public static CMD get(String s) throws ConfigureException {
			for (CMD c : values())
				if (c.name().equalsIgnoreCase(s))
					return c;
			throw new ConfigureException("Unknown command "+s);
		}
	}

	// everything having to do with the JSAP parameters. Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {
		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of text input and output files, if other than utf-8");
		jsap.registerParameter(encodingopt);

		// how do we combine the numbers?
		FlaggedOption semiringopt = new FlaggedOption("semiring",
				EnumeratedStringParser.getParser("tropical; log; probability"),
				"tropical",
				true,
				'm',
				"semiring",
				"type of weights for text input: tropical (min, +), log (-log sum, +) or probability (+, *). "+
				"Binary input carries its own type");
		jsap.registerParameter(semiringopt);

		FlaggedOption formatopt = new FlaggedOption("format",
				EnumeratedStringParser.getParser("binary; const; text"),
				"text",
				true,
				'f',
				"format",
				"format of the output automaton: text (AT&T), binary (vector) or const. "+
				"Input format is detected");
		jsap.registerParameter(formatopt);

		Switch acceptorsw = new Switch("acceptor",
				'a',
				"acceptor",
				"read and write text automata as acceptors, one label per transition");
		jsap.registerParameter(acceptorsw);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				JSAP.NO_SHORTFLAG,
				"time",
				"print timing information to stderr at this level of detail (1 or 2)");
		jsap.registerParameter(timeopt);

		FlaggedOption deltaopt = new FlaggedOption("delta",
				FloatStringParser.getParser(),
				Float.toString(Semiring.KDELTA),
				true,
				JSAP.NO_SHORTFLAG,
				"delta",
				"comparison and quantization threshold for weights");
		jsap.registerParameter(deltaopt);

		// command-specific options

		Switch nondetsw = new Switch("allownondet",
				JSAP.NO_SHORTFLAG,
				"allow-nondet",
				"minimize: accept non-deterministic input");
		jsap.registerParameter(nondetsw);

		FlaggedOption sortopt = new FlaggedOption("sorttype",
				EnumeratedStringParser.getParser("ilabel; olabel"),
				"ilabel",
				true,
				JSAP.NO_SHORTFLAG,
				"sort_type",
				"arcsort: sort transitions by input or output label");
		jsap.registerParameter(sortopt);

		Switch projectsw = new Switch("projectoutput",
				JSAP.NO_SHORTFLAG,
				"project_output",
				"project: keep output labels instead of input labels");
		jsap.registerParameter(projectsw);

		FlaggedOption nshortestopt = new FlaggedOption("nshortest",
				IntegerStringParser.getParser(),
				"1",
				true,
				JSAP.NO_SHORTFLAG,
				"nshortest",
				"shortestpath: number of paths to keep");
		jsap.registerParameter(nshortestopt);

		Switch uniquesw = new Switch("unique",
				JSAP.NO_SHORTFLAG,
				"unique",
				"shortestpath: keep only paths with distinct labels");
		jsap.registerParameter(uniquesw);

		FlaggedOption detopt = new FlaggedOption("dettype",
				EnumeratedStringParser.getParser("functional; nonfunctional; disambiguate"),
				"functional",
				true,
				JSAP.NO_SHORTFLAG,
				"det_type",
				"determinize: how to treat transducers with several outputs per input");
		jsap.registerParameter(detopt);

		FlaggedOption filteropt = new FlaggedOption("composefilter",
				EnumeratedStringParser.getParser("auto; null; trivial; sequence; alt_sequence; match; no_match"),
				"auto",
				true,
				JSAP.NO_SHORTFLAG,
				"compose_filter",
				"compose: epsilon filter");
		jsap.registerParameter(filteropt);

		Switch tofinalsw = new Switch("tofinal",
				JSAP.NO_SHORTFLAG,
				"to_final",
				"push: push weights toward the final states instead of the start");
		jsap.registerParameter(tofinalsw);

		Switch removetotalsw = new Switch("removetotal",
				JSAP.NO_SHORTFLAG,
				"remove_total_weight",
				"push: divide the total weight out");
		jsap.registerParameter(removetotalsw);

		Switch closureplussw = new Switch("closureplus",
				JSAP.NO_SHORTFLAG,
				"closure_plus",
				"closure: one or more repetitions instead of zero or more");
		jsap.registerParameter(closureplussw);

		// command and files at the end for nice placement in the usage statement
		UnflaggedOption cmdopt = new UnflaggedOption("command",
				StringStringParser.getParser(),
				null,
				true,
				false,
				"one of connect, invert, minimize, arcsort, topsort, project, shortestpath, reverse, rmepsilon, "+
				"determinize, compose, push, union, concat, closure, optimize, info");
		jsap.registerParameter(cmdopt);

		UnflaggedOption fileopt = new UnflaggedOption("files",
				FileStringParser.getParser(),
				null,
				true,
				true,
				"input automata (two for compose, union and concat), then the output file. "+
				"Without an output file the result goes to stdout");
		jsap.registerParameter(fileopt);

		JSAPResult config = jsap.parse(argv);
		if (config.success() && !config.getBoolean("help")) {
			CMD cmd = CMD.get(config.getString("command"));
			int n = config.getFileArray("files").length;
			if (n < cmd.getInputs() || n > cmd.getInputs()+1)
				throw new ConfigureException(cmd.name().toLowerCase()+" takes "+cmd.getInputs()+" input file(s) and an optional output file; got "+n+" files");
			if (config.getInt("nshortest") < 1)
				throw new ConfigureException("nshortest must be positive");
		}
		return config;
	}

	private static InputStream open(File f) throws FileNotFoundException {
		if (f.getName().equals("-"))
			return System.in;
		return new FileInputStream(f);
	}

	/** binary if it starts with the magic number, text otherwise */
	static VectorFst<Double> readFst(File f, FloatSemiring sr, boolean acceptor, String encoding) throws IOException, FstException {
		BufferedInputStream in = new BufferedInputStream(open(f));
		try {
			if (BinaryFormat.isBinary(in))
				return new VectorFst<Double>(BinaryFormat.read(in));
			return TextFormat.read(new BufferedReader(new InputStreamReader(in, encoding)), sr, acceptor);
		}
		catch (DataFormatException e) {
			throw new DataFormatException(f.getName()+": "+e.getMessage(), e);
		}
		finally {
			in.close();
		}
	}

	static void writeFst(VectorFst<Double> fst, OutputStream os, String format, boolean acceptor, String encoding) throws IOException, ConfigureException {
		if (format.equals("text")) {
			Writer w = new OutputStreamWriter(os, encoding);
			TextFormat.write(fst, w, acceptor);
			w.flush();
		}
		else
			BinaryFormat.write(fst, os, format.equals("const"));
		os.flush();
	}

	static String info(VectorFst<Double> fst) {
		StringBuilder sb = new StringBuilder();
		int finals = 0;
		for (int s = 0; s < fst.numStates(); s++)
			if (fst.isFinal(s))
				finals++;
		SccVisitor v = new SccVisitor(fst);
		sb.append("semiring\t").append(fst.getSemiring().getName()).append('\n');
		sb.append("start state\t").append(fst.start()).append('\n');
		sb.append("states\t").append(fst.numStates()).append('\n');
		sb.append("transitions\t").append(fst.numTransitions()).append('\n');
		sb.append("final states\t").append(finals).append('\n');
		sb.append("strongly connected components\t").append(v.numSccs()).append('\n');
		sb.append("acceptor\t").append(Fsts.isAcceptor(fst)).append('\n');
		sb.append("deterministic\t").append(Fsts.isDeterministic(fst)).append('\n');
		sb.append("epsilon-free\t").append(Fsts.isEpsilonFree(fst)).append('\n');
		sb.append("acyclic\t").append(v.isAcyclic()).append('\n');
		sb.append("input label sorted\t").append(Fsts.isSorted(fst, false)).append('\n');
		sb.append("output label sorted\t").append(Fsts.isSorted(fst, true));
		return sb.toString();
	}

	/** runs one command on its inputs; in-place commands may change the first input */
	static VectorFst<Double> run(CMD cmd, List<VectorFst<Double>> in, JSAPResult config) throws FstException {
		VectorFst<Double> fst = in.get(0);
		float delta = config.getFloat("delta");
		switch (cmd) {
		case CONNECT:
			Connect.connect(fst);
			return fst;
		case INVERT:
			Invert.invert(fst);
			return fst;
		case MINIMIZE:
			Minimize.minimize(fst, delta, config.getBoolean("allownondet"));
			return fst;
		case ARCSORT:
			TransitionSort.sort(fst, TransitionSort.get(config.getString("sorttype")));
			return fst;
		case TOPSORT:
			if (!TopSort.topSort(fst))
				Debug.prettyDebug("Warning: automaton is cyclic; left unsorted");
			return fst;
		case PROJECT:
			Project.project(fst, config.getBoolean("projectoutput") ? ProjectType.OUTPUT : ProjectType.INPUT);
			return fst;
		case SHORTESTPATH:
			return ShortestPath.shortestPath(fst, config.getInt("nshortest"), config.getBoolean("unique"),
							 new ShortestPathConfig().setDelta(delta));
		case REVERSE:
			return Reverse.reverse(fst);
		case RMEPSILON:
			RmEpsilon.rmEpsilon(fst, new RmEpsilonConfig().setDelta(delta));
			return fst;
		case DETERMINIZE:
			return Determinize.determinize(fst, new DeterminizeConfig()
						       .setDelta(delta)
						       .setType(DeterminizeType.get(config.getString("dettype"))));
		case COMPOSE: {
			ComposeConfig cc = new ComposeConfig().setFilterType(ComposeFilterType.get(config.getString("composefilter")));
			// at least one side has to be sorted on the shared labels
			if (!Fsts.isSorted(fst, true) && !Fsts.isSorted(in.get(1), false))
				TransitionSort.sort(in.get(1), TransitionSort.ILABEL);
			return Compose.compose(fst, in.get(1), cc);
		}
		case PUSH:
			Push.push(fst, config.getBoolean("tofinal") ? ReweightType.TO_FINAL : ReweightType.TO_INITIAL,
				  config.getBoolean("removetotal"), delta);
			return fst;
		case UNION:
			Union.union(fst, in.get(1));
			return fst;
		case CONCAT:
			Concat.concat(fst, in.get(1));
			return fst;
		case CLOSURE:
			Closure.closure(fst, config.getBoolean("closureplus") ? ClosureType.PLUS : ClosureType.STAR);
			return fst;
		case OPTIMIZE:
			Optimize.optimize(fst);
			return fst;
		default:
			throw new ConfigureException("No action for command "+cmd);
		}
	}

	public static void main(String argv[]) throws Exception {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		int timeLevel = -1;
		CMD cmd = null;
		String encoding = null;
		FloatSemiring sr = null;
		File[] files = null;

		// 1) Set up all parameters. Die on bad combinations.
		try {
			config = processParameters(jsap, argv);
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time")) {
				timeLevel = config.getInt("time", -1);
				Debug.setDbLevel(timeLevel);
			}
		}
		catch (JSAPException e) {
			System.err.println("wfst options improperly configured: "+e.getMessage());
			System.err.println("Try 'wfst -h' for a detailed help message");
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("wfst options improperly configured: "+e.getMessage());
			System.err.println("Usage: wfst "+jsap.getUsage());
			System.exit(1);
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("This is wfst, version "+VERSION);
			Debug.prettyDebug("Usage: wfst ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			System.exit(0);
		}

		if (!config.success()) {
			for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();)
				Debug.prettyDebug("Error: " + errs.next());
			Debug.prettyDebug("Usage: wfst ");
			Debug.prettyDebug("             "+jsap.getUsage());
			System.exit(1);
		}

		// 2) Read the automata, run, write
		try {
			cmd = CMD.get(config.getString("command"));
			sr = BinaryFormat.semiringForArcType(config.getString("semiring"));
			files = config.getFileArray("files");
			boolean acceptor = config.getBoolean("acceptor");
			Date preReadTime = new Date();
			ArrayList<VectorFst<Double>> in = new ArrayList<VectorFst<Double>>();
			for (int i = 0; i < cmd.getInputs(); i++)
				in.add(readFst(files[i], sr, acceptor, encoding));
			Debug.dbtime(timeLevel, 1, preReadTime, new Date(), "read "+in.size()+" automata");

			if (cmd == CMD.INFO) {
				System.out.println(info(in.get(0)));
				System.exit(0);
			}
			Date preRunTime = new Date();
			VectorFst<Double> result = run(cmd, in, config);
			Debug.dbtime(timeLevel, 1, preRunTime, new Date(), cmd.name().toLowerCase());

			OutputStream os = files.length > cmd.getInputs()
				? new BufferedOutputStream(new FileOutputStream(files[cmd.getInputs()]))
				: System.out;
			try {
				writeFst(result, os, config.getString("format"), acceptor, encoding);
			}
			finally {
				if (os != System.out)
					os.close();
			}
		}
		catch (ConfigureException e) {
			System.err.println("Can't run "+config.getString("command")+": "+message(e));
			System.exit(1);
		}
		catch (FileNotFoundException e) {
			System.err.println("File not found: "+e.getMessage());
			System.exit(1);
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading input file: "+message(e));
			System.exit(1);
		}
		catch (FstException e) {
			System.err.println(config.getString("command")+" failed: "+message(e));
			System.exit(1);
		}
		catch (IOException e) {
			System.err.println("Problem processing file: "+e.getMessage());
			System.exit(1);
		}
	}

	// message followed by the messages of its causes
	static String message(Throwable e) {
		StringBuilder sb = new StringBuilder(String.valueOf(e.getMessage()));
		for (Throwable c = e.getCause(); c != null && c != e; c = c.getCause())
			if (c.getMessage() != null && !sb.toString().contains(c.getMessage()))
				sb.append(": ").append(c.getMessage());
		return sb.toString();
	}
}
