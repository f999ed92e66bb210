package org.perlcheck.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only lookup tables shared by the tokenizer, the document parser and the policies.
 */
public final class ParserTables {

    // Names of CORE functions and keywords. A call to one of these is never a user subroutine.
    public static final Set<String> BUILTINS = Set.of(
            "abs", "accept", "alarm", "and", "atan2", "bind", "binmode", "bless", "break",
            "caller", "catch", "chdir", "chmod", "chomp", "chop", "chown", "chr", "chroot", "class",
            "close", "closedir", "cmp", "connect", "continue", "cos", "crypt", "dbmclose", "dbmopen",
            "default", "defer", "defined", "delete", "die", "do", "dump", "each", "else", "elsif",
            "endgrent", "endhostent", "endnetent", "endprotoent", "endpwent", "endservent", "eof", "eq",
            "eval", "evalbytes", "exec", "exists", "exit", "exp", "fc", "fcntl", "field", "fileno",
            "finally", "flock", "for", "foreach", "fork", "format", "formline", "ge", "getc",
            "getgrent", "getgrgid", "getgrnam", "gethostbyaddr", "gethostbyname", "gethostent",
            "getlogin", "getnetbyaddr", "getnetbyname", "getnetent", "getpeername", "getpgrp",
            "getppid", "getpriority", "getprotobyname", "getprotobynumber", "getprotoent", "getpwent",
            "getpwnam", "getpwuid", "getservbyname", "getservbyport", "getservent", "getsockname",
            "getsockopt", "given", "glob", "gmtime", "goto", "grep", "gt", "hex", "if", "index", "int",
            "ioctl", "isa", "join", "keys", "kill", "last", "lc", "lcfirst", "le", "length", "link",
            "listen", "local", "localtime", "lock", "log", "lstat", "lt", "m", "map", "method", "mkdir",
            "msgctl", "msgget", "msgrcv", "msgsnd", "my", "ne", "next", "no", "not", "oct", "open",
            "opendir", "or", "ord", "our", "pack", "package", "pipe", "pop", "pos", "print", "printf",
            "prototype", "push", "q", "qq", "qr", "quotemeta", "qw", "qx", "rand", "read", "readdir",
            "readline", "readlink", "readpipe", "recv", "redo", "ref", "rename", "require", "reset",
            "return", "reverse", "rewinddir", "rindex", "rmdir", "s", "say", "scalar", "seek",
            "seekdir", "select", "semctl", "semget", "semop", "send", "setgrent", "sethostent",
            "setnetent", "setpgrp", "setpriority", "setprotoent", "setpwent", "setservent",
            "setsockopt", "shift", "shmctl", "shmget", "shmread", "shmwrite", "shutdown", "sin",
            "sleep", "socket", "socketpair", "sort", "splice", "split", "sprintf", "sqrt", "srand",
            "stat", "state", "study", "sub", "substr", "symlink", "syscall", "sysopen", "sysread",
            "sysseek", "system", "syswrite", "tell", "telldir", "tie", "tied", "time", "times", "tr",
            "truncate", "try", "uc", "ucfirst", "umask", "undef", "unless", "unlink", "unpack",
            "unshift", "untie", "until", "use", "utime", "values", "vec", "wait", "waitpid",
            "wantarray", "warn", "when", "while", "write", "x", "xor", "y"
    );

    // Barewords with a fixed meaning to perl.
    public static final Set<String> SPECIAL_BAREWORDS = Set.of(
            "__FILE__", "__LINE__", "__PACKAGE__", "__SUB__", "__CLASS__", "__DATA__", "__END__",
            "AUTOLOAD", "BEGIN", "UNITCHECK", "CHECK", "INIT", "END", "DESTROY", "ADJUST", "CORE", "NULL"
    );

    public static final Set<String> FILEHANDLES = Set.of("STDIN", "STDOUT", "STDERR", "ARGV", "ARGVOUT", "DATA");

    // Words the tokenizer turns into operator tokens.
    public static final Set<String> WORD_OPERATORS = Set.of(
            "and", "or", "xor", "not", "x", "lt", "gt", "le", "ge", "eq", "ne", "cmp"
    );

    public static final Set<String> QUOTE_LIKE_WORDS = Set.of("q", "qq", "qw", "qx", "qr", "m", "s", "tr", "y");

    public static final String FILE_TEST_LETTERS = "rwxoRWXOezsfdlpSbcugktTBAMC";

    // Words after which an opening curly brace starts a block.
    public static final Set<String> BLOCK_WORDS = Set.of(
            "sub", "do", "eval", "map", "grep", "sort", "else", "continue", "try", "catch", "finally",
            "defer", "BEGIN", "END", "INIT", "CHECK", "UNITCHECK", "ADJUST", "AUTOLOAD", "DESTROY", "default"
    );

    public static final Set<String> COMPOUND_WORDS = Set.of(
            "if", "unless", "while", "until", "for", "foreach", "given", "when", "try"
    );

    public static final Set<String> CONDITION_WORDS = Set.of("if", "elsif", "unless", "while", "until", "given", "when");

    public static final Set<String> SCHEDULED_BLOCKS = Set.of("BEGIN", "END", "INIT", "CHECK", "UNITCHECK");

    public static final Set<String> BREAK_WORDS = Set.of("return", "last", "next", "redo", "goto", "dump");

    public static final Set<String> VARIABLE_DECLARATORS = Set.of("my", "our", "local", "state");

    public static final Set<String> INCLUDE_WORDS = Set.of("use", "no", "require");

    // Words whose argument is a label rather than a subroutine call.
    public static final Set<String> LABEL_POINTERS = Set.of("next", "last", "redo", "goto", "dump");

    // Map to store operator precedence values. A higher number binds tighter.
    private static final Map<String, Integer> precedenceMap = new HashMap<>();

    // Precedence of named unary operators such as the file tests.
    public static final int NAMED_UNARY_PRECEDENCE = 16;

    static {
        addOperatorsToMap(1, "or", "xor");
        addOperatorsToMap(2, "and");
        addOperatorsToMap(3, "not");
        addOperatorsToMap(5, ",", "=>");
        addOperatorsToMap(6, "=", "**=", "+=", "*=", "&=", "&.=", "<<=", "&&=", "-=", "/=", "|=", "|.=", ">>=", "||=", ".=", "%=", "^=", "^.=", "//=", "^^=", "x=");
        addOperatorsToMap(7, "?", ":");
        addOperatorsToMap(8, "..", "...");
        addOperatorsToMap(9, "||", "^^", "//");
        addOperatorsToMap(10, "&&");
        addOperatorsToMap(11, "|", "^", "|.", "^.");
        addOperatorsToMap(12, "&", "&.");
        addOperatorsToMap(13, "==", "!=", "<=>", "eq", "ne", "cmp", "~~");
        addOperatorsToMap(14, "<", ">", "<=", ">=", "lt", "gt", "le", "ge");
        addOperatorsToMap(15, "isa");
        addOperatorsToMap(17, ">>", "<<");
        addOperatorsToMap(18, "+", "-", ".");
        addOperatorsToMap(19, "*", "/", "%", "x");
        addOperatorsToMap(20, "=~", "!~");
        addOperatorsToMap(21, "!", "~", "~.", "\\");
        addOperatorsToMap(22, "**");
        addOperatorsToMap(23, "++", "--");
        addOperatorsToMap(24, "->");
    }

    private ParserTables() {
    }

    private static void addOperatorsToMap(int precedence, String... operators) {
        for (String operator : operators) {
            precedenceMap.put(operator, precedence);
        }
    }

    /**
     * The precedence of an operator, or null if it is not a known operator.
     * File tests such as {@code -e} are named unary operators.
     */
    public static Integer getPrecedence(String operator) {
        Integer precedence = precedenceMap.get(operator);
        if (precedence == null && isFileTest(operator)) {
            return NAMED_UNARY_PRECEDENCE;
        }
        return precedence;
    }

    public static boolean isFileTest(String operator) {
        return operator.length() == 2 && operator.charAt(0) == '-'
                && FILE_TEST_LETTERS.indexOf(operator.charAt(1)) >= 0;
    }
}
