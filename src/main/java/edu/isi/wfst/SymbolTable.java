package edu.isi.wfst;

import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.io.BufferedReader;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Bijection between label ids and human-readable symbols. Purely cosmetic as far as the
 * algorithms go. Label 0 is epsilon, written {@code <eps>} by default.
 */
public class SymbolTable {
	public static final String EPSILON_SYMBOL = "<eps>";
	static final int MAGIC = 2125658996;

	private String name;
	private final TObjectIntHashMap<String> symbolToKey = new TObjectIntHashMap<String>(16, 0.5f, -1);
	private final TIntObjectHashMap<String> keyToSymbol = new TIntObjectHashMap<String>();
	// insertion order, so tables write out the way they were built
	private final ArrayList<String> symbols = new ArrayList<String>();
	private int availableKey = 0;

	/** a table holding only epsilon */
	public SymbolTable(String name) {
		this(name, true);
	}
	// the readers start without epsilon; it comes from the file
	private SymbolTable(String name, boolean withEpsilon) {
		this.name = name;
		if (withEpsilon)
			addSymbol(EPSILON_SYMBOL, Transition.EPSILON);
	}

	public String getName() { return name; }
	public void setName(String n) { name = n; }

	/** key of sym, adding it with the next free key if it is new */
	public int addSymbol(String sym) {
		int k = symbolToKey.get(sym);
		if (k != -1)
			return k;
		return addSymbol(sym, availableKey);
	}
	/** adds sym under key; returns the existing key if sym is already present */
	public int addSymbol(String sym, int key) {
		int k = symbolToKey.get(sym);
		if (k != -1)
			return k;
		if (keyToSymbol.containsKey(key))
			throw new IllegalArgumentException("Key "+key+" already maps to "+keyToSymbol.get(key));
		symbolToKey.put(sym, key);
		keyToSymbol.put(key, sym);
		symbols.add(sym);
		if (key >= availableKey)
			availableKey = key+1;
		return key;
	}
	/** -1 if absent */
	public int find(String sym) {
		return symbolToKey.get(sym);
	}
	/** null if absent */
	public String find(int key) {
		return keyToSymbol.get(key);
	}
	public boolean contains(String sym) {
		return symbolToKey.containsKey(sym);
	}
	public boolean contains(int key) {
		return keyToSymbol.containsKey(key);
	}
	public int size() {
		return symbols.size();
	}
	public int getAvailableKey() {
		return availableKey;
	}
	/** symbols in insertion order */
	public List<String> getSymbols() {
		return new ArrayList<String>(symbols);
	}

	// same symbol/key pairs; names are not compared
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof SymbolTable))
			return false;
		SymbolTable t = (SymbolTable)o;
		if (t.size() != size())
			return false;
		for (String s : symbols)
			if (t.find(s) != find(s))
				return false;
		return true;
	}
	public int hashCode() {
		int h = 0;
		for (String s : symbols)
			h += s.hashCode() ^ find(s);
		return h;
	}
	public String toString() {
		return "SymbolTable("+name+", "+size()+" symbols)";
	}

	/** symbol TAB key, one per line */
	public void writeText(Writer w) throws IOException {
		for (String s : symbols)
			w.write(s+"\t"+find(s)+"\n");
		w.flush();
	}
	public static SymbolTable readText(BufferedReader br, String name) throws IOException, DataFormatException {
		SymbolTable t = new SymbolTable(name, false);
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			line = line.trim();
			if (line.length() == 0)
				continue;
			String[] f = line.split("\\s+");
			if (f.length != 2)
				throw new DataFormatException("Line "+lineno+": expected symbol and key, got \""+line+"\"");
			int key;
			try {
				key = Integer.parseInt(f[1]);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Line "+lineno+": bad key "+f[1], e);
			}
			if (key < 0)
				throw new DataFormatException("Line "+lineno+": negative key "+key);
			try {
				t.addSymbol(f[0], key);
			}
			catch (IllegalArgumentException e) {
				throw new DataFormatException("Line "+lineno+": "+e.getMessage(), e);
			}
		}
		return t;
	}

	public void writeBinary(DataOutputStream out) throws IOException {
		LittleEndian.writeInt(out, MAGIC);
		LittleEndian.writeString(out, name == null ? "" : name);
		LittleEndian.writeLong(out, availableKey);
		LittleEndian.writeLong(out, symbols.size());
		for (String s : symbols) {
			LittleEndian.writeString(out, s);
			LittleEndian.writeLong(out, find(s));
		}
	}
	public static SymbolTable readBinary(DataInputStream in) throws IOException, DataFormatException {
		int magic = LittleEndian.readInt(in);
		if (magic != MAGIC)
			throw new DataFormatException("Bad symbol table magic number "+magic);
		SymbolTable t = new SymbolTable(LittleEndian.readString(in), false);
		long avail = LittleEndian.readLong(in);
		long n = LittleEndian.readLong(in);
		if (n < 0)
			throw new DataFormatException("Negative symbol count "+n);
		for (long i = 0; i < n; i++) {
			String sym = LittleEndian.readString(in);
			long key = LittleEndian.readLong(in);
			if (key < 0 || key > Integer.MAX_VALUE)
				throw new DataFormatException("Symbol "+sym+" has unusable key "+key);
			try {
				t.addSymbol(sym, (int)key);
			}
			catch (IllegalArgumentException e) {
				throw new DataFormatException(e.getMessage(), e);
			}
		}
		if (avail > t.availableKey && avail <= Integer.MAX_VALUE)
			t.availableKey = (int)avail;
		return t;
	}
}
