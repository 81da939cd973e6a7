package edu.brandeis.cosi103a.bracket.viewer;

/**
 * Thrown when a requested tournament is not hosted by this service.
 */
public class TournamentNotFoundException extends RuntimeException {
    public TournamentNotFoundException(String message) {
        super(message);
    }
}
