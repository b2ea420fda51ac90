package kgrs.core.rules.library;

import kgrs.core.rdf.Namespaces;
import kgrs.core.rdf.Term;

/**
 * Terms of the library domain the fixed rule sets work on.
 * All names live in the default namespace except rdf:type.
 */
public class LibraryVocabulary {

    public final Term.Iri type = Namespaces.RDF_TYPE;

    // Classes
    public final Term.Iri book;
    public final Term.Iri loan;
    public final Term.Iri user;
    public final Term.Iri frequentBorrower;

    // Source relations
    public final Term.Iri hasAuthor;
    public final Term.Iri hasGenre;
    public final Term.Iri borrowedBy;
    public final Term.Iri prefersGenre;
    public final Term.Iri loanOf;
    public final Term.Iri hasBook;

    // Derived relations
    public final Term.Iri wrote;
    public final Term.Iri relatedTo;
    public final Term.Iri hasExpertise;
    public final Term.Iri recommendedFor;

    public LibraryVocabulary(String namespace) {
        this.book = Term.iri(namespace + "Book");
        this.loan = Term.iri(namespace + "Loan");
        this.user = Term.iri(namespace + "User");
        this.frequentBorrower = Term.iri(namespace + "FrequentBorrower");
        this.hasAuthor = Term.iri(namespace + "hasAuthor");
        this.hasGenre = Term.iri(namespace + "hasGenre");
        this.borrowedBy = Term.iri(namespace + "borrowedBy");
        this.prefersGenre = Term.iri(namespace + "prefersGenre");
        this.loanOf = Term.iri(namespace + "loanOf");
        this.hasBook = Term.iri(namespace + "hasBook");
        this.wrote = Term.iri(namespace + "wrote");
        this.relatedTo = Term.iri(namespace + "relatedTo");
        this.hasExpertise = Term.iri(namespace + "hasExpertise");
        this.recommendedFor = Term.iri(namespace + "recommendedFor");
    }

    public static LibraryVocabulary of(Namespaces namespaces) {
        return new LibraryVocabulary(namespaces.getDefaultNamespace());
    }
}
