package edu.isi.wfst;
/** symbol tables of two automata disagree where an operation
    needs them to line up (output of the first vs. input of the second in composition, etc.) */
public class IncompatibleSymbolTablesException extends FstException {
    /**          Constructs a new exception with null as its detail message. */
    public IncompatibleSymbolTablesException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public IncompatibleSymbolTablesException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public IncompatibleSymbolTablesException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public IncompatibleSymbolTablesException(Throwable cause) { super(cause); } 
}
