package edu.isi.wfst;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// tracing and timing output, all on stderr.
// Algorithms guard their calls with a local "boolean debug = false;" so nothing
// is printed in normal operation.
public class Debug {

    static String encoding = "utf-8";
    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }

    private static OutputStreamWriter w=null;
    private static void initializeStream() {
	try {
	    w = new OutputStreamWriter(System.err, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(System.err);
	}
    }

    // stuff we always print: usage, warnings
    public static void prettyDebug(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }
    // true debugging stuff, prefixed by the calling class and method
    public static void debug(boolean d, String s)  {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	write(caller.getClassName()+":"+caller.getMethodName(), s);
    }
    private static void write(String caller, String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(caller+" : "+s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }
    private static int dblevel=0;
    public static void setDbLevel(int i) {
	dblevel = i;
    }
    // print time debug info if the level is proper
    public static void dbtime(int currlevel, int needlevel, Date pta, Date ptb, String msg) {
	if (currlevel < needlevel)
	    return;
	if (w == null)
	    initializeStream();
	long x = ptb.getTime() - pta.getTime();
	try {
	    w.write(msg+": "+x+" ms\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+msg);
	}
    }

    // global version of dbtime
    public static void dbtime(int needlevel, Date pta, String msg) {
	dbtime(dblevel, needlevel, pta, new Date(), msg);
    }

}
