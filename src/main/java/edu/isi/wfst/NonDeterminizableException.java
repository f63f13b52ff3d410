package edu.isi.wfst;
/** thrown when determinization cannot proceed: functional mode
    invoked on a non-functional transducer, or the configured state limit was reached */
public class NonDeterminizableException extends FstException {
    /**          Constructs a new exception with null as its detail message. */
    public NonDeterminizableException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public NonDeterminizableException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public NonDeterminizableException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public NonDeterminizableException(Throwable cause) { super(cause); } 
}
