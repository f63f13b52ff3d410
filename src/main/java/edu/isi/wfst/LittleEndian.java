package edu.isi.wfst;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

// fixed-width little-endian fields, the byte order of OpenFst files. Data streams are
// big-endian, so everything gets its bytes reversed on the way through
class LittleEndian {
	private LittleEndian() {}

	static int readInt(DataInputStream in) throws IOException {
		return Integer.reverseBytes(in.readInt());
	}
	static long readLong(DataInputStream in) throws IOException {
		return Long.reverseBytes(in.readLong());
	}
	static float readFloat(DataInputStream in) throws IOException {
		return Float.intBitsToFloat(readInt(in));
	}
	// i32 length then that many utf-8 bytes
	static String readString(DataInputStream in) throws IOException, DataFormatException {
		int n = readInt(in);
		if (n < 0)
			throw new DataFormatException("Negative string length "+n);
		byte[] b = new byte[n];
		try {
			in.readFully(b);
		}
		catch (EOFException e) {
			throw new DataFormatException("File ends inside a string of length "+n, e);
		}
		return new String(b, StandardCharsets.UTF_8);
	}

	static void writeInt(DataOutputStream out, int v) throws IOException {
		out.writeInt(Integer.reverseBytes(v));
	}
	static void writeLong(DataOutputStream out, long v) throws IOException {
		out.writeLong(Long.reverseBytes(v));
	}
	static void writeFloat(DataOutputStream out, float v) throws IOException {
		writeInt(out, Float.floatToIntBits(v));
	}
	static void writeString(DataOutputStream out, String s) throws IOException {
		byte[] b = s.getBytes(StandardCharsets.UTF_8);
		writeInt(out, b.length);
		out.write(b);
	}
}
