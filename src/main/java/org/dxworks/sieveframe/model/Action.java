package org.dxworks.sieveframe.model;

public class Action {
    public ActionType actionType = ActionType.KEEP;
    public String argument = ""; // folder, address or flag; empty for keep/stop/discard

    public Action() {
    }

    public Action(ActionType actionType, String argument) {
        this.actionType = actionType;
        this.argument = argument;
    }
}
