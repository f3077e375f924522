package dk.cloudcreate.estatemanagement.merchant;

public record Device(DeviceId deviceId, String deviceIdentifier) {
}
